package com.vtb.refiner.suppression;

import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.ControlStrength;
import com.vtb.refiner.models.StrideCategory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LegacyControlFlagsTest {

    @Test
    void enabledFlagsBecomeGlobalControls() {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("waf_enabled", true);
        flags.put("mtls_enabled", "true");
        flags.put("rate_limiting", false);

        List<Control> controls = LegacyControlFlags.toControls(flags);

        assertEquals(2, controls.size());
        Control mtls = controls.get(0);
        assertEquals("Mutual TLS", mtls.getName());
        assertEquals(ControlStrength.FULL, mtls.getStrength());
        assertTrue(mtls.covers(StrideCategory.SPOOFING));
        assertTrue(mtls.isGlobal());

        Control waf = controls.get(1);
        assertEquals(ControlStrength.PARTIAL, waf.getStrength());
        assertTrue(waf.covers(StrideCategory.TAMPERING));
    }

    @Test
    void unknownFlagsAreIgnored() {
        List<Control> controls = LegacyControlFlags.toControls(Map.of("quantum_shield", true, "HTTPS_ENABLED", true));

        assertEquals(1, controls.size());
        assertEquals("HTTPS", controls.get(0).getName());
    }

    @Test
    void formatDetection() {
        assertTrue(LegacyControlFlags.isLegacyFormat(Map.of("secrets_manager", false)));
        assertFalse(LegacyControlFlags.isLegacyFormat(Map.of("controls", List.of())));
        assertFalse(LegacyControlFlags.isLegacyFormat(null));
    }
}
