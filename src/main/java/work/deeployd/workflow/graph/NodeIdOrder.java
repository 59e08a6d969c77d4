package work.deeployd.workflow.graph;

import java.util.Comparator;

/**
 * Orders node ids numerically when both are digit strings, otherwise lexically; numeric ids sort first.
 */
public final class NodeIdOrder implements Comparator<String> {
    public static final NodeIdOrder INSTANCE = new NodeIdOrder();

    private NodeIdOrder() {}

    @Override
    public int compare(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            String a = stripLeadingZeros(left);
            String b = stripLeadingZeros(right);
            if (a.length() != b.length()) {
                return Integer.compare(a.length(), b.length());
            }
            int cmp = a.compareTo(b);
            return cmp != 0 ? cmp : left.compareTo(right);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    public static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String value) {
        int i = 0;
        while (i < value.length() - 1 && value.charAt(i) == '0') {
            i++;
        }
        return value.substring(i);
    }
}
