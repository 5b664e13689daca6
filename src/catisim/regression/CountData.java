package catisim.regression;

/**
 * Вход регрессии: отклик-счётчик, одна ковариата, фиксированный offset и группа случайного intercept.
 * Группы пронумерованы 0..groupCount-1.
 */
public record CountData(int[] response,
                        double[] covariate,
                        double[] offset,
                        int[] group,
                        int groupCount) {

    public CountData {
        int n = response.length;
        if (covariate.length != n || offset.length != n || group.length != n) {
            throw new IllegalArgumentException("all columns must have length " + n);
        }
        if (groupCount <= 0) {
            throw new IllegalArgumentException("groupCount must be > 0");
        }
        for (int g : group) {
            if (g < 0 || g >= groupCount) {
                throw new IllegalArgumentException("group index out of range: " + g);
            }
        }
    }

    public int size() {
        return response.length;
    }
}
