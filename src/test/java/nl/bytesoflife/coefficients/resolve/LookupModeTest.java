package nl.bytesoflife.coefficients.resolve;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LookupModeTest {

    @Test
    void parsesNamesAndAliases() {
        assertEquals(LookupMode.CEILING, LookupMode.fromName("ceiling"));
        assertEquals(LookupMode.CEILING, LookupMode.fromName(" Bucket "));
        assertEquals(LookupMode.BILINEAR, LookupMode.fromName("BILINEAR"));
        assertEquals(LookupMode.BILINEAR, LookupMode.fromName("interpolate"));
    }

    @Test
    void parsingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(LookupMode.BILINEAR, LookupMode.fromName("BILINEAR"));
            assertEquals(LookupMode.BILINEAR, LookupMode.fromName("INTERPOLATE"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void rejectsUnknownMode() {
        assertThrows(IllegalArgumentException.class, () -> LookupMode.fromName("nearest"));
        assertThrows(IllegalArgumentException.class, () -> LookupMode.fromName(null));
    }

    @Test
    void createsMatchingPolicy() {
        assertInstanceOf(CeilingLookupPolicy.class, LookupMode.CEILING.createPolicy());
        assertInstanceOf(BilinearLookupPolicy.class, LookupMode.BILINEAR.createPolicy());
    }
}
