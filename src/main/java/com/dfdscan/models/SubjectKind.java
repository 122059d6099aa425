package com.dfdscan.models;

/**
 * Объект, к которому привязана угроза: элемент или поток данных
 */
public enum SubjectKind {
    ELEMENT,
    DATAFLOW
}
