package me.toymail.mailbox.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuadOptionTest {

    @Test
    public void testToggle_FlipsAffirmativePart() {
        assertEquals(QuadOption.NO, QuadOption.YES.toggle());
        assertEquals(QuadOption.YES, QuadOption.NO.toggle());
        assertEquals(QuadOption.ASK_YES, QuadOption.ASK_NO.toggle());
        assertEquals(QuadOption.ASK_NO, QuadOption.ASK_YES.toggle());
    }

    @Test
    public void testToggle_TwiceRestoresValue() {
        for (QuadOption q : new QuadOption[] { QuadOption.NO, QuadOption.YES, QuadOption.ASK_NO, QuadOption.ASK_YES }) {
            assertEquals(q, q.toggle().toggle());
        }
    }

    @Test
    public void testToggle_AbortRefused() {
        assertThrows(ImmutablePolicyException.class, QuadOption.ABORT::toggle);
    }

    @Test
    public void testResolve_FixedValuesNeverPrompt() {
        Prompter prompter = (q, d) -> fail("should not prompt");
        assertEquals(QuadOption.YES, QuadOption.YES.resolve(prompter, "Purge?"));
        assertEquals(QuadOption.NO, QuadOption.NO.resolve(prompter, "Purge?"));
        assertEquals(QuadOption.ABORT, QuadOption.ABORT.resolve(prompter, "Purge?"));
    }

    @Test
    public void testResolve_AskPassesDefaultToPrompter() {
        List<QuadOption> defaults = new ArrayList<>();
        Prompter prompter = (q, d) -> {
            defaults.add(d);
            return d;
        };

        assertEquals(QuadOption.YES, QuadOption.ASK_YES.resolve(prompter, "Purge?"));
        assertEquals(QuadOption.NO, QuadOption.ASK_NO.resolve(prompter, "Purge?"));
        assertEquals(List.of(QuadOption.YES, QuadOption.NO), defaults);
    }

    @Test
    public void testResolve_AskReturnsUserAnswer() {
        assertEquals(QuadOption.NO, QuadOption.ASK_YES.resolve((q, d) -> QuadOption.NO, "Purge?"));
        assertEquals(QuadOption.ABORT, QuadOption.ASK_NO.resolve((q, d) -> QuadOption.ABORT, "Purge?"));
    }

    @Test
    public void testResolve_NoPrompterUsesDefault() {
        assertEquals(QuadOption.YES, QuadOption.ASK_YES.resolve(null, "Purge?"));
        assertEquals(QuadOption.NO, QuadOption.ASK_NO.resolve(null, "Purge?"));
    }

    @Test
    public void testResolve_UnresolvedAnswerRejected() {
        assertThrows(IllegalStateException.class, () -> QuadOption.ASK_YES.resolve((q, d) -> QuadOption.ASK_NO, "?"));
        assertThrows(IllegalStateException.class, () -> QuadOption.ASK_YES.resolve((q, d) -> null, "?"));
    }

    @Test
    public void testParse_AcceptsConfigNames() {
        assertEquals(QuadOption.ASK_YES, QuadOption.parse("ask-yes"));
        assertEquals(QuadOption.ASK_NO, QuadOption.parse(" ASK_NO "));
        assertEquals(QuadOption.YES, QuadOption.parse("Yes"));
        assertEquals(QuadOption.ABORT, QuadOption.parse("abort"));
    }

    @Test
    public void testParse_InvalidValue() {
        assertThrows(IllegalArgumentException.class, () -> QuadOption.parse("maybe"));
        assertThrows(IllegalArgumentException.class, () -> QuadOption.parse(null));
    }

    @Test
    public void testToString_IsConfigName() {
        assertEquals("ask-yes", QuadOption.ASK_YES.toString());
    }
}
