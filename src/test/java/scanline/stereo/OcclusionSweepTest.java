package scanline.stereo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Occlusion cost sweep")
class OcclusionSweepTest {

    @Test
    @DisplayName("Default sweep rounds quarter steps to one decimal")
    void defaultCosts() {
        List<Double> costs = new OcclusionSweep().costs();

        assertEquals(18, costs.size());
        assertEquals(List.of(0.5, 0.8, 1.0, 1.2, 1.5, 1.8, 2.0, 2.2, 2.5), costs.subList(0, 9));
        assertEquals(4.8, costs.get(costs.size() - 1));
    }

    @Test
    @DisplayName("Custom range rounds the tenths of each cost, ties to even")
    void customRangeRounding() {
        // 0.05, 0.15.., 0.25, 0.35.., 0.45 scaled by ten are 0.5, 1.5.., 2.5, 3.5.., 4.5
        assertEquals(List.of(0.0, 0.2, 0.2, 0.4, 0.4), new OcclusionSweep(0.05, 0.5, 0.1).costs());
    }

    @Test
    @DisplayName("Stop value is excluded")
    void stopExclusive() {
        assertEquals(List.of(1.0, 2.0), new OcclusionSweep(1.0, 3.0, 1.0).costs());
        assertEquals(List.of(), new OcclusionSweep(2.0, 2.0, 1.0).costs());
    }

    @Test
    @DisplayName("File names carry the occlusion cost")
    void fileNames() {
        assertEquals("Displeft0.8.png", OcclusionSweep.leftFileName(0.8));
        assertEquals("Dispright2.0.png", OcclusionSweep.rightFileName(2.0));
    }

    @Test
    @DisplayName("Non positive step or start is rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class, () -> new OcclusionSweep(0.5, 5.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new OcclusionSweep(0.0, 5.0, 0.25));
    }

    @Test
    @DisplayName("Unbounded stop is rejected instead of sweeping forever")
    void nonFiniteStop() {
        assertThrows(IllegalArgumentException.class, () -> new OcclusionSweep(0.5, Double.NaN, 0.25));
        assertThrows(IllegalArgumentException.class, () -> new OcclusionSweep(0.5, Double.POSITIVE_INFINITY, 0.25));
        assertThrows(IllegalArgumentException.class, () -> new OcclusionSweep(Double.POSITIVE_INFINITY, 5.0, 0.25));
    }
}
