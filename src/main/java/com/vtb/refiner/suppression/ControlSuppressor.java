package com.vtb.refiner.suppression;

import com.vtb.refiner.models.Control;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Подавление угроз, закрытых внедрёнными контролями.
 *
 * Угроза подавляется, если контроль со strength = FULL покрывает её категорию STRIDE и
 * применяется к её каноническому компоненту или глобально. Несопоставленные компоненты
 * не подавляются. Результат зависит только от угрозы и списка контролей.
 */
@Slf4j
public class ControlSuppressor {

    public static final String REASON_PREFIX = "control:";

    private final List<Control> controls;

    public ControlSuppressor(List<Control> controls) {
        this.controls = controls != null ? List.copyOf(controls) : List.of();
    }

    public boolean hasControls() {
        return !controls.isEmpty();
    }

    /**
     * Первый (в порядке входа) контроль, закрывающий угрозу
     */
    public Optional<Control> findSuppressingControl(Threat threat) {
        if (!threat.isActive() || threat.isUnmatchedComponent() || threat.getCanonicalComponent() == null) {
            return Optional.empty();
        }
        for (Control control : controls) {
            if (control.canSuppress()
                && control.covers(threat.getStrideCategory())
                && (control.isGlobal() || control.touchesComponent(threat.getCanonicalComponent()))) {
                return Optional.of(control);
            }
        }
        return Optional.empty();
    }

    /**
     * @return true, если угроза подавлена
     */
    public boolean apply(Threat threat) {
        Optional<Control> control = findSuppressingControl(threat);
        if (control.isEmpty()) {
            return false;
        }
        threat.suppress(REASON_PREFIX + control.get().getName());
        log.debug("Угроза {} подавлена контролем '{}' ({} / {})", threat.getId(), control.get().getName(),
            threat.getCanonicalComponent(), threat.getStrideCategory());
        return true;
    }
}
