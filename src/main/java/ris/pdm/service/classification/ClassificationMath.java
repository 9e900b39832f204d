package ris.pdm.service.classification;

/** 집계 수치 규칙: 건수는 0 이상, 비율은 % 단위 소수점 1자리 */
public final class ClassificationMath {

    private ClassificationMath() {
    }

    public static long clampCount(long value) {
        return Math.max(0L, value);
    }

    public static double roundRate(double rate) {
        if (Double.isNaN(rate) || rate < 0) {
            return 0.0;
        }
        return Math.round(rate * 10.0) / 10.0;
    }

    /** {@code part / total * 100}, total이 0이면 0 */
    public static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return roundRate(clampCount(part) * 100.0 / total);
    }

    /** {@code max(0, total - unclassified)} */
    public static long classified(long total, long unclassified) {
        return clampCount(total - clampCount(unclassified));
    }
}
