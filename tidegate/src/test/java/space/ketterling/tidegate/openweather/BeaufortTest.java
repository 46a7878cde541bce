package space.ketterling.tidegate.openweather;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BeaufortTest {

    @Test
    void mapsBoundaries() {
        assertEquals(0, Beaufort.fromMetersPerSecond(0.0));
        assertEquals(0, Beaufort.fromMetersPerSecond(0.49));
        assertEquals(1, Beaufort.fromMetersPerSecond(0.5));
        assertEquals(4, Beaufort.fromMetersPerSecond(7.0));
        assertEquals(8, Beaufort.fromMetersPerSecond(17.1));
        assertEquals(11, Beaufort.fromMetersPerSecond(32.5));
        assertEquals(12, Beaufort.fromMetersPerSecond(32.6));
        assertEquals(12, Beaufort.fromMetersPerSecond(60));
    }
}
