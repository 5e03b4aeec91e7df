package com.vtb.refiner.risk;

import com.vtb.refiner.models.Component;
import com.vtb.refiner.models.ComponentType;
import com.vtb.refiner.models.DataClassification;
import com.vtb.refiner.models.StrideCategory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Формулировки бизнес-последствий по типу компонента и категории STRIDE
 */
public final class BusinessImpactCatalog {

    private static final Map<StrideCategory, String> CONSEQUENCES = new EnumMap<>(StrideCategory.class);
    private static final Map<String, String> SPECIFIC = new HashMap<>();

    static {
        CONSEQUENCES.put(StrideCategory.SPOOFING, "Impersonation of legitimate identities in");
        CONSEQUENCES.put(StrideCategory.TAMPERING, "Loss of integrity of");
        CONSEQUENCES.put(StrideCategory.REPUDIATION, "Loss of accountability for");
        CONSEQUENCES.put(StrideCategory.INFORMATION_DISCLOSURE, "Loss of confidentiality of");
        CONSEQUENCES.put(StrideCategory.DENIAL_OF_SERVICE, "Loss of availability of");
        CONSEQUENCES.put(StrideCategory.ELEVATION_OF_PRIVILEGE, "Unauthorized privilege escalation through");

        // Частные случаи с более точной формулировкой
        SPECIFIC.put(key(ComponentType.DATA_STORE, StrideCategory.INFORMATION_DISCLOSURE),
            "Confidentiality loss: bulk exposure of records held in '%s'");
        SPECIFIC.put(key(ComponentType.DATA_STORE, StrideCategory.TAMPERING),
            "Integrity loss: unauthorized modification of records held in '%s'");
        SPECIFIC.put(key(ComponentType.DATA_FLOW, StrideCategory.INFORMATION_DISCLOSURE),
            "Confidentiality loss: interception of data in transit over '%s'");
        SPECIFIC.put(key(ComponentType.DATA_FLOW, StrideCategory.TAMPERING),
            "Integrity loss: manipulation of data in transit over '%s'");
        SPECIFIC.put(key(ComponentType.EXTERNAL_ENTITY, StrideCategory.SPOOFING),
            "Fraud exposure: attackers acting as '%s' towards the system");
        SPECIFIC.put(key(ComponentType.PROCESS, StrideCategory.ELEVATION_OF_PRIVILEGE),
            "Control loss: attackers gaining privileged execution in '%s'");
    }

    private BusinessImpactCatalog() {
    }

    /**
     * @param component компонент из инвентаря, null для несопоставленной угрозы
     * @param componentName имя для текста (каноническое или как в источнике)
     */
    public static String describe(Component component, String componentName, StrideCategory category) {
        ComponentType type = component != null ? component.getType() : null;
        String specific = type != null ? SPECIFIC.get(key(type, category)) : null;

        StringBuilder statement = new StringBuilder();
        if (specific != null) {
            statement.append(String.format(specific, componentName));
        } else {
            statement.append(CONSEQUENCES.getOrDefault(category, "Security impact on"))
                .append(' ')
                .append(type != null ? type.getAssetPhrase() : "component")
                .append(" '").append(componentName).append('\'');
        }

        DataClassification classification = component != null ? component.getDataClassification() : null;
        if (classification != null) {
            if (classification.isRegulated()) {
                statement.append(", involving ").append(classification.name())
                    .append(" data with regulatory implications");
            } else {
                statement.append(", involving ").append(classification.name().toLowerCase(Locale.ROOT)).append(" data");
            }
        }
        return statement.append('.').toString();
    }

    private static String key(ComponentType type, StrideCategory category) {
        return type.name() + "/" + category.name();
    }
}
