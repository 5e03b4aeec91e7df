package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.ComponentType;
import com.vtb.refiner.models.StrideCategory;
import com.vtb.refiner.models.Threat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentNameStandardizerTest {

    private final List<Component> inventory = List.of(
        component("Payment API", ComponentType.PROCESS),
        component("Customer Database", ComponentType.DATA_STORE),
        component("Web Client to Payment API", ComponentType.DATA_FLOW));

    @Test
    void caseAndWhitespaceDifferencesMatch() {
        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(inventory, 0.6);
        Threat threat = threat("  payment   api");

        assertTrue(standardizer.standardize(threat));
        assertEquals("Payment API", threat.getCanonicalComponent());
        assertEquals(ComponentType.PROCESS, threat.getComponentType());
        assertFalse(threat.isUnmatchedComponent());
        assertEquals("  payment   api", threat.getComponentRef(), "Исходное имя должно сохраняться");
    }

    @Test
    void dataFlowWrappersAreStripped() {
        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(inventory, 0.6);

        Threat prefixed = threat("Data Flow from Web Client to Payment API");
        assertTrue(standardizer.standardize(prefixed));
        assertEquals("Web Client to Payment API", prefixed.getCanonicalComponent());

        Threat suffixed = threat("Web Client to Payment API data flow");
        assertTrue(standardizer.standardize(suffixed));
        assertEquals("Web Client to Payment API", suffixed.getCanonicalComponent());
    }

    @Test
    void belowThresholdIsFlaggedUnmatched() {
        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(inventory, 0.6);
        Threat threat = threat("Mainframe batch scheduler");

        assertFalse(standardizer.standardize(threat));
        assertTrue(threat.isUnmatchedComponent());
        assertNull(threat.getCanonicalComponent());
        assertEquals("Mainframe batch scheduler", threat.getEffectiveComponent());
    }

    @Test
    void tieKeepsInventoryOrder() {
        List<Component> ambiguous = List.of(
            component("Orders API", ComponentType.PROCESS),
            component("Orders APP", ComponentType.PROCESS));
        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(ambiguous, 0.6);

        ComponentNameStandardizer.Match match = standardizer.findBestMatch("orders ap");
        assertNotNull(match);
        assertEquals("Orders API", match.component().getCanonicalName());

        ComponentNameStandardizer reversed = new ComponentNameStandardizer(List.of(ambiguous.get(1), ambiguous.get(0)), 0.6);
        assertEquals("Orders APP", reversed.findBestMatch("orders ap").component().getCanonicalName());
    }

    @Test
    void emptyInventoryMatchesNothing() {
        ComponentNameStandardizer standardizer = new ComponentNameStandardizer(List.of(), 0.6);
        assertFalse(standardizer.hasInventory());
        assertNull(standardizer.findBestMatch("Payment API"));
    }

    private static Component component(String name, ComponentType type) {
        return Component.builder().canonicalName(name).type(type).build();
    }

    private static Threat threat(String componentRef) {
        return Threat.builder()
            .id("THREAT-0001")
            .componentRef(componentRef)
            .strideCategory(StrideCategory.TAMPERING)
            .description("Request body can be modified")
            .inherentRiskScore(5.0)
            .build();
    }
}
