package com.dfdscan.analysis;

import com.dfdscan.models.StrideCategory;
import com.dfdscan.models.SubjectKind;
import com.dfdscan.models.ThreatFinding;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Необязательная дедупликация угроз.
 *
 * Шаблон библиотеки и встроенное правило могут описать один и тот же риск дважды.
 * По умолчанию дубликаты сохраняются; этот шаг оставляет первую угрозу
 * для каждой комбинации (объект, категория, набор STRIDE).
 */
public final class FindingDeduplicator {

    private FindingDeduplicator() {}

    public static List<ThreatFinding> deduplicate(List<ThreatFinding> findings) {
        List<ThreatFinding> result = new ArrayList<>();
        if (findings == null) {
            return result;
        }
        Set<DedupKey> seen = new HashSet<>();
        for (ThreatFinding finding : findings) {
            if (finding != null && seen.add(DedupKey.of(finding))) {
                result.add(finding);
            }
        }
        return result;
    }

    private static final class DedupKey {
        private final SubjectKind kind;
        private final String subjectId;
        private final String category;
        private final Set<StrideCategory> stride;

        private DedupKey(SubjectKind kind, String subjectId, String category, Set<StrideCategory> stride) {
            this.kind = kind;
            this.subjectId = subjectId;
            this.category = category;
            this.stride = stride;
        }

        static DedupKey of(ThreatFinding finding) {
            Set<StrideCategory> stride = EnumSet.noneOf(StrideCategory.class);
            if (finding.getStride() != null) {
                stride.addAll(finding.getStride());
            }
            String category = finding.getCategory() != null ? finding.getCategory().toLowerCase(Locale.ROOT) : "";
            return new DedupKey(
                finding.getSubject() != null ? finding.getSubject().getKind() : null,
                finding.getSubject() != null ? finding.getSubject().getId() : null,
                category,
                stride);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DedupKey)) return false;
            DedupKey other = (DedupKey) o;
            return kind == other.kind
                && Objects.equals(subjectId, other.subjectId)
                && category.equals(other.category)
                && stride.equals(other.stride);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, subjectId, category, stride);
        }
    }
}
