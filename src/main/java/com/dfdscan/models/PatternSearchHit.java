package com.dfdscan.models;

import lombok.Value;

/**
 * Результат поиска по библиотеке: шаблон и корзина (тип объекта), в которой он найден
 */
@Value
public class PatternSearchHit {
    String bucket;
    ThreatPattern pattern;
}
