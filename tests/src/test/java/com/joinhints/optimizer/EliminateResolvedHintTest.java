package com.joinhints.optimizer;

import com.joinhints.hint.HintInfo;
import com.joinhints.hint.JoinHint;
import com.joinhints.hint.JoinStrategyHint;
import com.joinhints.logical.Except;
import com.joinhints.logical.Intersect;
import com.joinhints.logical.Join;
import com.joinhints.logical.Limit;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.Project;
import com.joinhints.logical.ResolvedHint;
import com.joinhints.test.RecordingHintErrorHandler;
import com.joinhints.test.TestBase;
import com.joinhints.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.joinhints.test.PlanFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for moving resolved hints into joins.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("EliminateResolvedHint Tests")
public class EliminateResolvedHintTest extends TestBase {

    private static final HintInfo BROADCAST = HintInfo.of(JoinStrategyHint.BROADCAST);
    private static final HintInfo MERGE = HintInfo.of(JoinStrategyHint.SHUFFLE_MERGE);
    private static final HintInfo SHUFFLE_HASH = HintInfo.of(JoinStrategyHint.SHUFFLE_HASH);

    private RecordingHintErrorHandler handler;
    private EliminateResolvedHint rule;

    @Override
    protected void doSetUp() {
        handler = new RecordingHintErrorHandler();
        rule = new EliminateResolvedHint(handler);
    }

    private static Join hintedJoin(LogicalPlan left, LogicalPlan right, HintInfo leftHint, HintInfo rightHint) {
        return innerJoin(left, right).copy(left, right, JoinHint.of(leftHint, rightHint));
    }

    @Nested
    @DisplayName("Hints On Join Inputs")
    class JoinInputTests {

        @Test
        @DisplayName("A hinted input becomes the join's hint for that side")
        void testLeftHint() {
            LogicalPlan result = rule.apply(innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers()));

            assertThat(result).isEqualTo(hintedJoin(orders(), customers(), BROADCAST, null));
            assertThat(((Join) result).hint().rightHint()).isEmpty();
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("Both inputs can be hinted")
        void testBothSides() {
            LogicalPlan result = rule.apply(innerJoin(
                resolved(JoinStrategyHint.SHUFFLE_MERGE, orders()),
                resolved(JoinStrategyHint.SHUFFLE_HASH, customers())));

            assertThat(result).isEqualTo(hintedJoin(orders(), customers(), MERGE, SHUFFLE_HASH));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("Stacked hints merge outermost first")
        void testStackedHints() {
            LogicalPlan stacked = resolved(JoinStrategyHint.BROADCAST,
                resolved(JoinStrategyHint.SHUFFLE_HASH, orders()));

            LogicalPlan result = rule.apply(innerJoin(stacked, customers()));

            assertThat(result).isEqualTo(hintedJoin(orders(), customers(), BROADCAST, null));
            assertThat(handler.overridden).containsExactly(SHUFFLE_HASH);
        }

        @Test
        @DisplayName("Repeating the same strategy is not an override")
        void testRepeatedStrategy() {
            LogicalPlan stacked = resolved(JoinStrategyHint.BROADCAST,
                resolved(JoinStrategyHint.BROADCAST, orders()));

            LogicalPlan result = rule.apply(innerJoin(stacked, customers()));

            assertThat(result).isEqualTo(hintedJoin(orders(), customers(), BROADCAST, null));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("A hint over a join applies to the enclosing join")
        void testNestedJoins() {
            LogicalPlan inner = innerJoin(orders(), customers());
            LogicalPlan plan = innerJoin(resolved(JoinStrategyHint.SHUFFLE_MERGE, inner), table("sales.items"));

            LogicalPlan result = rule.apply(plan);

            assertThat(result).isEqualTo(hintedJoin(inner, table("sales.items"), MERGE, null));
        }

        @Test
        @DisplayName("Extracted hints are listed outermost first")
        void testExtractOrder() {
            LogicalPlan input = new Limit(resolved(JoinStrategyHint.BROADCAST,
                new Project(resolved(JoinStrategyHint.SHUFFLE_MERGE, orders()), List.of("id"))), 10);

            EliminateResolvedHint.Extracted extracted = EliminateResolvedHint.extractHintsFromPlan(input);

            assertThat(extracted.hints()).containsExactly(BROADCAST, MERGE);
            assertThat(extracted.plan()).isEqualTo(new Limit(new Project(orders(), List.of("id")), 10));
        }
    }

    @Nested
    @DisplayName("Propagation Through Other Operators")
    class PropagationTests {

        @Test
        @DisplayName("Hints pass through single-child operators")
        void testUnaryOperators() {
            LogicalPlan left = new Limit(new Project(resolved(JoinStrategyHint.BROADCAST, orders()), List.of("id")), 5);

            LogicalPlan result = rule.apply(innerJoin(left, customers()));

            LogicalPlan expectedLeft = new Limit(new Project(orders(), List.of("id")), 5);
            assertThat(result).isEqualTo(hintedJoin(expectedLeft, customers(), BROADCAST, null));
        }

        @Test
        @DisplayName("Hints pass through the left input of INTERSECT and EXCEPT")
        void testSetOperationLeftInput() {
            LogicalPlan intersect = new Intersect(resolved(JoinStrategyHint.BROADCAST, orders()), table("sales.returns"), true);
            LogicalPlan except = new Except(resolved(JoinStrategyHint.SHUFFLE_HASH, customers()), table("sales.blocked"), true);

            LogicalPlan result = rule.apply(innerJoin(intersect, except));

            assertThat(result).isEqualTo(hintedJoin(
                new Intersect(orders(), table("sales.returns"), true),
                new Except(customers(), table("sales.blocked"), true),
                BROADCAST, SHUFFLE_HASH));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("INTERSECT ALL and EXCEPT ALL stop the search")
        void testSetOperationAllForms() {
            LogicalPlan intersectAll = new Intersect(resolved(JoinStrategyHint.BROADCAST, orders()), table("sales.returns"), false);
            LogicalPlan exceptAll = new Except(resolved(JoinStrategyHint.SHUFFLE_HASH, customers()), table("sales.blocked"), false);

            LogicalPlan result = rule.apply(innerJoin(intersectAll, exceptAll));

            assertThat(result).isEqualTo(innerJoin(
                new Intersect(orders(), table("sales.returns"), false),
                new Except(customers(), table("sales.blocked"), false)));
            assertThat(((Join) result).hint()).isEqualTo(JoinHint.NONE);
            assertThat(handler.joinNotFound).containsExactly(BROADCAST, SHUFFLE_HASH);
        }

        @Test
        @DisplayName("Hints on the right input of INTERSECT do not reach the join")
        void testSetOperationRightInput() {
            LogicalPlan intersect = new Intersect(orders(), resolved(JoinStrategyHint.BROADCAST, table("sales.returns")), true);

            LogicalPlan result = rule.apply(innerJoin(intersect, customers()));

            assertThat(result).isEqualTo(innerJoin(new Intersect(orders(), table("sales.returns"), true), customers()));
            assertThat(((Join) result).hint()).isEqualTo(JoinHint.NONE);
            assertThat(handler.joinNotFound).containsExactly(BROADCAST);
        }
    }

    @Nested
    @DisplayName("Hints Without A Join")
    class OrphanHintTests {

        @Test
        @DisplayName("A hint reaching no join is reported and removed")
        void testNoJoin() {
            LogicalPlan result = rule.apply(new Project(resolved(JoinStrategyHint.SHUFFLE_MERGE, orders()), List.of("id")));

            assertThat(result).isEqualTo(new Project(orders(), List.of("id")));
            assertThat(handler.joinNotFound).containsExactly(MERGE);
        }

        @Test
        @DisplayName("An empty hint is removed like any other")
        void testEmptyHint() {
            LogicalPlan result = rule.apply(new ResolvedHint(orders()));

            assertThat(result).isEqualTo(orders());
            assertThat(handler.joinNotFound).containsExactly(HintInfo.empty());
        }

        @Test
        @DisplayName("A join that already has a hint keeps it and leaves its inputs alone")
        void testAlreadyHintedJoin() {
            Join join = hintedJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers(), SHUFFLE_HASH, null);

            LogicalPlan result = rule.apply(join);

            assertThat(result).isEqualTo(hintedJoin(orders(), customers(), SHUFFLE_HASH, null));
            assertThat(handler.joinNotFound).containsExactly(BROADCAST);
        }
    }

    @Test
    @DisplayName("Applying the rule twice changes nothing more")
    void testIdempotent() {
        LogicalPlan plan = innerJoin(
            resolved(JoinStrategyHint.BROADCAST, resolved(JoinStrategyHint.SHUFFLE_HASH, orders())),
            new Project(resolved(JoinStrategyHint.SHUFFLE_MERGE, customers()), List.of("id")));

        LogicalPlan once = rule.apply(plan);
        int callbacks = handler.totalCallbacks();
        LogicalPlan twice = rule.apply(once);

        assertThat(twice).isEqualTo(once);
        assertThat(twice.collect(ResolvedHint.class)).isEmpty();
        assertThat(handler.totalCallbacks()).isEqualTo(callbacks);
    }
}
