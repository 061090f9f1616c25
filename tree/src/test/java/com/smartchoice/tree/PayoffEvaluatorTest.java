package com.smartchoice.tree;

import com.smartchoice.tree.error.EvaluationException;
import com.smartchoice.tree.spec.PayoffFn;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static com.smartchoice.tree.fixture.TreeFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PayoffEvaluatorTest {

    @Test
    @SuppressWarnings("unchecked")
    void payoffIsCalledOncePerTerminal_withThePathMaps() {
        PayoffFn payoff = mock(PayoffFn.class);
        when(payoff.payoff(anyMap(), anyMap(), anyMap())).thenReturn(42.0);
        List<TreeNode> arena = TreeBuilder.build(bidBag(payoff));

        PayoffEvaluator.evaluate(arena);

        verify(payoff, times(18)).payoff(anyMap(), anyMap(), anyMap());
        verify(payoff).payoff(
                eq(Map.of("bid", 500.0, "competitor_bid", 400.0, "cost", 200.0)),
                eq(Map.of("competitor_bid", 0.35, "cost", 0.25)),
                eq(Map.of("bid", "low", "competitor_bid", "low", "cost", "low")));
        assertEquals(42.0, arena.get(FIRST_TERMINAL).ev());
        assertNull(arena.get(ROOT).ev());
    }

    @Test
    @SuppressWarnings("unchecked")
    void payoffMapsAreReadOnly() {
        PayoffFn payoff = mock(PayoffFn.class);
        List<TreeNode> arena = TreeBuilder.build(bidBag(payoff));
        PayoffEvaluator.evaluate(arena);

        ArgumentCaptor<Map<String, Double>> values = ArgumentCaptor.forClass(Map.class);
        verify(payoff, atLeastOnce()).payoff(values.capture(), any(), any());
        assertThrows(UnsupportedOperationException.class, () -> values.getValue().put("x", 1.0));
    }

    @Test
    void terminalRemembersItsInputs() {
        List<TreeNode> arena = TreeBuilder.build(bidBag());
        PayoffEvaluator.evaluate(arena);

        TerminalNode terminal = (TerminalNode) arena.get(20);
        assertEquals(Map.of("bid", "high", "competitor_bid", "medium", "cost", "low"), terminal.lastBranches());
        assertEquals(Map.of("competitor_bid", 0.5, "cost", 0.25), terminal.lastProbabilities());
        assertEquals(0.0, terminal.ev());
    }

    @Test
    void bidPayoffsMatchTheHandCalculation() {
        List<TreeNode> arena = TreeBuilder.build(bidBag());
        PayoffEvaluator.evaluate(arena);
        // low bid: competitor low -> lose; competitor medium -> 500 - cost
        assertEquals(0.0, arena.get(3).ev());
        assertEquals(300.0, arena.get(7).ev());
        assertEquals(100.0, arena.get(8).ev());
        assertEquals(-100.0, arena.get(9).ev());
        // high bid only wins against the high competitor bid
        assertEquals(0.0, arena.get(20).ev());
        assertEquals(500.0, arena.get(24).ev());
    }

    @Test
    void missingPayoffFails() {
        List<TreeNode> arena = TreeBuilder.build(bidBag(null));
        var ex = assertThrows(EvaluationException.class, () -> PayoffEvaluator.evaluate(arena));
        assertTrue(ex.getMessage().contains("has no payoff function"), ex.getMessage());
    }

    @Test
    void payoffFailureIsWrapped_withCause() {
        IllegalStateException boom = new IllegalStateException("boom");
        List<TreeNode> arena = TreeBuilder.build(bidBag((v, p, b) -> {
            throw boom;
        }));
        var ex = assertThrows(EvaluationException.class, () -> PayoffEvaluator.evaluate(arena));
        assertSame(boom, ex.getCause());
        assertTrue(ex.getMessage().contains("boom"), ex.getMessage());
    }

    @Test
    void evaluationExceptionFromPayoffPassesThrough() {
        EvaluationException own = new EvaluationException("not a number");
        List<TreeNode> arena = TreeBuilder.build(bidBag((v, p, b) -> {
            throw own;
        }));
        assertSame(own, assertThrows(EvaluationException.class, () -> PayoffEvaluator.evaluate(arena)));
    }
}
