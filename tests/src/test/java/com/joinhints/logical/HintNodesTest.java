package com.joinhints.logical;

import com.joinhints.hint.HintInfo;
import com.joinhints.hint.JoinHint;
import com.joinhints.hint.JoinStrategyHint;
import com.joinhints.test.TestBase;
import com.joinhints.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.joinhints.test.PlanFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the UnresolvedHint and ResolvedHint plan nodes.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Hint Node Tests")
public class HintNodesTest extends TestBase {

    @Nested
    @DisplayName("UnresolvedHint")
    class UnresolvedHintTests {

        @Test
        @DisplayName("Is never resolved, and makes every ancestor unresolved")
        void testNeverResolved() {
            UnresolvedHint hint = hint("BROADCAST", orders());
            LogicalPlan plan = innerJoin(hint, customers());

            assertThat(hint.resolved()).isFalse();
            assertThat(plan.resolved()).isFalse();
            assertThat(innerJoin(orders(), customers()).resolved()).isTrue();
        }

        @Test
        @DisplayName("Keeps name, parameters and child")
        void testAccessors() {
            UnresolvedHint hint = hint("MERGE", orders(), "t1", List.of("db", "t2"));

            assertThat(hint.name()).isEqualTo("MERGE");
            assertThat(hint.parameters()).containsExactly("t1", List.of("db", "t2"));
            assertThat(hint.child()).isEqualTo(orders());
            assertThat(hint).hasToString("UnresolvedHint MERGE(t1, db.t2)");
        }

        @Test
        @DisplayName("Has the schema of its child")
        void testSchemaDelegation() {
            assertThat(hint("BROADCAST", orders()).schema()).isEqualTo(ORDERS_SCHEMA);
        }

        @Test
        @DisplayName("Parameters cannot be modified after construction")
        void testParametersImmutable() {
            UnresolvedHint hint = hint("BROADCAST", orders(), "t1");

            assertThatThrownBy(() -> hint.parameters().add("t2"))
                .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("ResolvedHint")
    class ResolvedHintTests {

        @Test
        @DisplayName("Has the schema of its child")
        void testSchemaDelegation() {
            ResolvedHint hint = resolved(JoinStrategyHint.BROADCAST, orders());

            assertThat(hint.schema()).isEqualTo(orders().schema());
            assertThat(hint.resolved()).isTrue();
        }

        @Test
        @DisplayName("Canonicalizes to its child's canonical form for any hint")
        void testCanonicalizeErasesHint() {
            LogicalPlan child = new Limit(alias(orders(), "o"), 10);

            assertThat(new ResolvedHint(child).canonicalize()).isEqualTo(child.canonicalize());
            for (JoinStrategyHint strategy : JoinStrategyHint.values()) {
                assertThat(resolved(strategy, child).canonicalize()).isEqualTo(child.canonicalize());
            }
        }

        @Test
        @DisplayName("Plans differing only in hints have the same result")
        void testSameResult() {
            LogicalPlan hinted = innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers());
            LogicalPlan plain = innerJoin(orders(), customers());

            assertThat(hinted).isNotEqualTo(plain);
            assertThat(hinted.sameResult(plain)).isTrue();
        }

        @Test
        @DisplayName("Defaults to an empty hint and displays its hint")
        void testDefaultsAndDisplay() {
            assertThat(new ResolvedHint(orders()).hints()).isEqualTo(HintInfo.empty());
            assertThat(resolved(JoinStrategyHint.SHUFFLE_HASH, orders()))
                .hasToString("ResolvedHint (strategy=shuffle_hash)");
        }
    }

    @Test
    @DisplayName("Join canonical form drops the join hint")
    void testJoinCanonicalizeDropsHint() {
        Join hinted = innerJoin(orders(), customers())
            .copy(orders(), customers(), JoinHint.of(HintInfo.of(JoinStrategyHint.BROADCAST), null));

        assertThat(hinted.canonicalize()).isEqualTo(innerJoin(orders(), customers()));
        assertThat(hinted).hasToString("Join(INNER, using=[id], leftHint=(strategy=broadcast))");
    }
}
