package net.cronbeat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 선점 쿼리에 AND 로 덧붙는 추가 조건 (예: 특정 kind 만 처리하는 인스턴스).
 */
public record JobCriterion(Attribute attribute, Operator operator, List<String> values) {

    public enum Attribute { NAME, KIND }

    public enum Operator { EQ, NE, IN, LIKE }

    public JobCriterion {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
        values = List.copyOf(values);
        if (values.isEmpty()) throw new IllegalArgumentException("criterion needs at least one value");
        if (operator != Operator.IN && values.size() != 1) {
            throw new IllegalArgumentException(operator + " takes exactly one value");
        }
    }

    public static JobCriterion kindIs(String kind) {
        return new JobCriterion(Attribute.KIND, Operator.EQ, List.of(kind));
    }

    public static JobCriterion kindIn(List<String> kinds) {
        return new JobCriterion(Attribute.KIND, Operator.IN, kinds);
    }

    public static JobCriterion kindIsNot(String kind) {
        return new JobCriterion(Attribute.KIND, Operator.NE, List.of(kind));
    }

    /** SQL LIKE 패턴 (%, _) */
    public static JobCriterion nameLike(String pattern) {
        return new JobCriterion(Attribute.NAME, Operator.LIKE, List.of(pattern));
    }

    public static JobCriterion nameIs(String name) {
        return new JobCriterion(Attribute.NAME, Operator.EQ, List.of(name));
    }

    /** 인메모리 평가. null 컬럼은 어떤 조건도 만족하지 않는다 (SQL 과 동일) */
    public boolean matches(CronJob job) {
        String actual = switch (attribute) {
            case NAME -> job.name();
            case KIND -> job.kind();
        };
        if (actual == null) return false;
        return switch (operator) {
            case EQ -> actual.equals(values.get(0));
            case NE -> !actual.equals(values.get(0));
            case IN -> values.contains(actual);
            case LIKE -> actual.matches(likeToRegex(values.get(0)));
        };
    }

    private static String likeToRegex(String like) {
        var sb = new StringBuilder();
        for (char ch : like.toCharArray()) {
            switch (ch) {
                case '%' -> sb.append(".*");
                case '_' -> sb.append('.');
                default -> sb.append(java.util.regex.Pattern.quote(String.valueOf(ch)));
            }
        }
        return sb.toString();
    }
}
