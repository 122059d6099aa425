package com.dfdscan.models;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Ссылка на объект угрозы: id, имя и тип элемента или потока
 */
@Value
@Builder
@Jacksonized
public class SubjectRef {
    SubjectKind kind;
    String id;
    String name;
    String type;

    public static SubjectRef of(DfdElement element) {
        ElementType elementType = element.getElementType();
        return SubjectRef.builder()
            .kind(SubjectKind.ELEMENT)
            .id(element.getId())
            .name(element.getName())
            .type(elementType != null ? elementType.getValue() : element.getType())
            .build();
    }

    public static SubjectRef of(Dataflow dataflow) {
        return SubjectRef.builder()
            .kind(SubjectKind.DATAFLOW)
            .id(dataflow.getId())
            .name(dataflow.getName())
            .type(dataflow.getType() != null ? dataflow.getType() : "dataflow")
            .build();
    }

    public boolean refersTo(SubjectKind expectedKind, String subjectId) {
        return kind == expectedKind && id != null && id.equals(subjectId);
    }
}
