package gr.imsi.athenarc.historian.merge;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class FillPolicyTest {

    private static final double NaN = Double.NaN;

    private static double[] filled(FillPolicy policy, double... column) {
        double[] copy = Arrays.copyOf(column, column.length);
        policy.fill(copy);
        return copy;
    }

    @Test
    public void testPolicies() {
        double[] column = {NaN, 1.0, NaN, NaN, 4.0, NaN};
        assertArrayEquals(new double[]{1.0, 1.0, 1.0, 1.0, 4.0, 4.0}, filled(FillPolicy.FORWARD_BACKWARD, column));
        assertArrayEquals(new double[]{NaN, 1.0, 1.0, 1.0, 4.0, 4.0}, filled(FillPolicy.FORWARD, column));
        assertArrayEquals(new double[]{1.0, 1.0, 4.0, 4.0, 4.0, NaN}, filled(FillPolicy.BACKWARD, column));
        assertArrayEquals(column, filled(FillPolicy.NONE, column));
    }

    @Test
    public void testFillIsIdempotent() {
        double[] column = {NaN, 2.0, NaN, 3.0, NaN};
        for (FillPolicy policy : FillPolicy.values()) {
            double[] once = filled(policy, column);
            assertArrayEquals(once, filled(policy, once), policy.name());
        }
    }

    @Test
    public void testParse() {
        assertEquals(FillPolicy.FORWARD_BACKWARD, FillPolicy.parse("forward-backward"));
        assertEquals(FillPolicy.NONE, FillPolicy.parse(" none "));
        assertThrows(IllegalArgumentException.class, () -> FillPolicy.parse("linear"));
    }
}
