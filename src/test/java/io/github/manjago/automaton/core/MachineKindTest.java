package io.github.manjago.automaton.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MachineKind, its descriptors and the action table.
 */
class MachineKindTest {

    @ParameterizedTest
    @CsvSource({
        "twa, TWO_WAY",
        "TM, TURING",
        "pda, PUSHDOWN",
        "2pda, TWO_STACK_PUSHDOWN",
        "two_pda, TWO_STACK_PUSHDOWN",
        "twopda, TWO_STACK_PUSHDOWN",
        "transducer, TRANSDUCER",
        "trans, TRANSDUCER",
        "gtrans, TRANSDUCER",
        "gt, TRANSDUCER"
    })
    @DisplayName("Kind names and aliases")
    void testFromName(String name, MachineKind expected) {
        assertEquals(expected, MachineKind.fromName(name));
    }

    @Test
    @DisplayName("Unknown kind name")
    void testUnknown() {
        assertNull(MachineKind.fromName("nfa"));
    }

    @ParameterizedTest
    @EnumSource(MachineKind.class)
    @DisplayName("Short name resolves back to the kind")
    void testShortName(MachineKind kind) {
        assertEquals(kind, MachineKind.fromName(kind.getShortName()));
    }

    @Test
    @DisplayName("Descriptors")
    void testDescriptors() {
        VariantDescriptor pda = MachineKind.PUSHDOWN.descriptor();
        assertEquals(HeadMovement.ONE_WAY, pda.headMovement());
        assertEquals(Acceptance.EMPTY_STACK, pda.acceptance());
        assertTrue(pda.permits(Action.POP1));
        assertFalse(pda.permits(Action.PUSH2));

        VariantDescriptor gt = MachineKind.TRANSDUCER.descriptor();
        assertTrue(gt.boundaryShortcut());
        assertTrue(gt.permits(Action.PRINT));
        assertFalse(gt.usesDirections());

        assertTrue(MachineKind.TURING.descriptor().permits(Action.WRITE_TAPE));
        assertFalse(MachineKind.TWO_WAY.descriptor().permits(Action.WRITE_TAPE));
        assertTrue(MachineKind.TWO_WAY.descriptor().usesDirections());
    }

    @ParameterizedTest
    @EnumSource(MachineKind.class)
    @DisplayName("Read-only actions are permitted everywhere")
    void testReadOnlyActions(MachineKind kind) {
        assertTrue(kind.descriptor().permits(Action.SCAN));
        assertTrue(kind.descriptor().permits(Action.NONE));
    }

    @Test
    @DisplayName("Action words")
    void testActionWords() {
        assertEquals(Action.PUSH1, Action.fromWord("Write"));
        assertEquals(Action.POP1, Action.fromWord("read1"));
        assertEquals(Action.PUSH2, Action.fromWord("push2"));
        assertEquals(Action.POP2, Action.fromWord("READ2"));
        assertEquals(Action.PRINT, Action.fromWord("print"));
        assertNull(Action.fromWord("write-tape"));
        assertEquals("WTape", Action.WRITE_TAPE.getDisplayName());
    }
}
