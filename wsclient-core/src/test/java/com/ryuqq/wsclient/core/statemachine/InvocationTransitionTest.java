package com.ryuqq.wsclient.core.statemachine;

import com.ryuqq.wsclient.core.exception.ErrorKind;
import com.ryuqq.wsclient.core.exception.NoPendingInvocationException;
import org.junit.jupiter.api.Test;

import static com.ryuqq.wsclient.core.statemachine.InvocationEvent.*;
import static com.ryuqq.wsclient.core.statemachine.InvocationState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * InvocationTransition 테스트.
 *
 * <ul>
 *   <li>NO_PENDING → PREPARE → PENDING</li>
 *   <li>PENDING → FINALIZE → NO_PENDING</li>
 *   <li>PENDING → PREPARE → PENDING (덮어쓰기 허용)</li>
 *   <li>NO_PENDING → FINALIZE 시 NoPendingInvocationException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InvocationTransitionTest {

    @Test
    void next_NoPendingPrepare_BecomesPending() {
        assertEquals(PENDING, InvocationTransition.next(NO_PENDING, PREPARE));
    }

    @Test
    void next_PendingFinalize_BecomesNoPending() {
        assertEquals(NO_PENDING, InvocationTransition.next(PENDING, FINALIZE));
    }

    @Test
    void next_PendingPrepare_StaysPendingAndDiscards() {
        // When
        InvocationState state = InvocationTransition.next(PENDING, PREPARE);

        // Then
        assertEquals(PENDING, state);
        assertTrue(InvocationTransition.discardsPending(PENDING, PREPARE));
        assertFalse(InvocationTransition.discardsPending(NO_PENDING, PREPARE));
    }

    @Test
    void next_NoPendingFinalize_ThrowsNoPendingInvocation() {
        // When & Then
        NoPendingInvocationException exception = assertThrows(
            NoPendingInvocationException.class,
            () -> InvocationTransition.next(NO_PENDING, FINALIZE)
        );
        assertEquals(ErrorKind.NO_PENDING_INVOCATION, exception.kind());
    }

    @Test
    void next_SecondFinalize_Throws() {
        // Given
        InvocationState state = InvocationTransition.next(NO_PENDING, PREPARE);
        state = InvocationTransition.next(state, FINALIZE);
        InvocationState finalState = state;

        // When & Then
        assertThrows(NoPendingInvocationException.class,
            () -> InvocationTransition.next(finalState, FINALIZE));
    }

    @Test
    void next_NullArguments_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> InvocationTransition.next(null, PREPARE));
        assertThrows(IllegalArgumentException.class, () -> InvocationTransition.next(PENDING, null));
    }
}
