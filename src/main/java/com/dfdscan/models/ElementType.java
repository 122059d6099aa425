package com.dfdscan.models;

/**
 * Типы элементов DFD.
 * Синонимы user и database приводятся к actor и datastore при чтении диаграммы.
 */
public enum ElementType {
    ACTOR("actor"),
    PROCESS("process"),
    DATASTORE("datastore"),
    EXTERNAL_ENTITY("external_entity");

    private final String value;

    ElementType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isExternal() {
        return this == ACTOR || this == EXTERNAL_ENTITY;
    }

    /**
     * Нормализовать строковый тип элемента. Регистр и пробелы значимы:
     * кроме канонических значений принимаются только синонимы user и database.
     *
     * @return тип или null, если строка не распознана
     */
    public static ElementType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        switch (raw) {
            case "actor":
            case "user":
                return ACTOR;
            case "process":
                return PROCESS;
            case "datastore":
            case "database":
                return DATASTORE;
            case "external_entity":
                return EXTERNAL_ENTITY;
            default:
                return null;
        }
    }
}
