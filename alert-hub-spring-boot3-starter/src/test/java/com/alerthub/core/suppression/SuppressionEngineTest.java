package com.alerthub.core.suppression;

import com.alerthub.core.StageOutcome;
import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.alerthub.support.TestFilters.rule;
import static org.junit.jupiter.api.Assertions.*;

class SuppressionEngineTest {

    private final Alert alert = Alert.create("disk full", AlertSeverity.ERROR, "disk-monitor");

    @Test
    void rulesRunInRegistrationOrder() {
        SuppressionEngine engine = new SuppressionEngine();
        engine.add(rule("first", a -> a.toBuilder().tag("a").build()));
        engine.add(rule("second", a -> a.toBuilder().tag(a.getTag() + "b").build()));

        StageOutcome out = engine.apply(alert);

        assertEquals("ab", out.getAlert().getTag());
        assertEquals(List.of("first", "second"), engine.rules().stream().map(r -> r.name()).toList());
    }

    @Test
    void nullResultSuppressesAndNamesTheRule() {
        SuppressionEngine engine = new SuppressionEngine();
        engine.add(rule("dedup", a -> null));
        engine.add(rule("never", a -> {
            throw new AssertionError("must not run");
        }));

        StageOutcome out = engine.apply(alert);

        assertTrue(out.isSuppressed());
        assertEquals("dedup", out.getSuppressedBy());
    }

    @Test
    void duplicateNameRejected() {
        SuppressionEngine engine = new SuppressionEngine();
        assertTrue(engine.add(rule("r", a -> a)));
        assertFalse(engine.add(rule("r", a -> null)));
        assertTrue(engine.remove("r").isPresent());
        assertEquals(0, engine.size());
    }

    @Test
    @DisplayName("a rule without a name still suppresses")
    void unnamedRuleSuppresses() {
        SuppressionEngine engine = new SuppressionEngine();
        engine.add(rule(null, a -> null));

        StageOutcome out = engine.apply(alert);

        assertTrue(out.isSuppressed());
        assertNull(out.getAlert());
        assertEquals(StageOutcome.UNNAMED, out.getSuppressedBy());
        assertTrue(engine.remove(null).isPresent());
    }
}
