package com.joinhints.analysis;

import com.joinhints.config.HintConf;
import com.joinhints.exception.AnalysisException;
import com.joinhints.hint.HintInfo;
import com.joinhints.hint.JoinStrategyHint;
import com.joinhints.logical.LogicalPlan;
import com.joinhints.logical.UnresolvedHint;
import com.joinhints.test.RecordingHintErrorHandler;
import com.joinhints.test.TestBase;
import com.joinhints.test.TestCategories;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.joinhints.test.PlanFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for resolving join strategy hints against the relations in their subtree.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ResolveJoinStrategyHints Tests")
public class ResolveJoinStrategyHintsTest extends TestBase {

    private RecordingHintErrorHandler handler;
    private ResolveJoinStrategyHints rule;

    @Override
    protected void doSetUp() {
        handler = new RecordingHintErrorHandler();
        rule = new ResolveJoinStrategyHints(HintConf.defaults(), handler);
    }

    @Nested
    @DisplayName("Hints Without Parameters")
    class WholeSubtreeTests {

        @Test
        @DisplayName("Apply to the entire subtree")
        void testWholeSubtree() {
            LogicalPlan join = innerJoin(orders(), customers());

            LogicalPlan result = rule.apply(hint("BROADCAST", join));

            assertThat(result).isEqualTo(resolved(JoinStrategyHint.BROADCAST, join));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("Names are matched regardless of case")
        void testCaseInsensitiveNames() {
            assertThat(rule.apply(hint("broadcast", orders())))
                .isEqualTo(resolved(JoinStrategyHint.BROADCAST, orders()));
            assertThat(rule.apply(hint("MapJoin", orders())))
                .isEqualTo(resolved(JoinStrategyHint.BROADCAST, orders()));
            assertThat(rule.apply(hint("shuffle_replicate_nl", orders())))
                .isEqualTo(resolved(JoinStrategyHint.SHUFFLE_REPLICATE_NL, orders()));
        }

        @Test
        @DisplayName("Other hints are left for later rules")
        void testUnknownHintUntouched() {
            UnresolvedHint unknown = hint("UNKNOWNHINT", orders());

            assertThat(rule.apply(unknown)).isSameAs(unknown);
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("The internal strategy cannot be requested by name")
        void testInternalStrategyNotResolvable() {
            UnresolvedHint internal = hint("NO_BROADCAST_HASH", orders());

            assertThat(rule.apply(internal)).isSameAs(internal);
        }
    }

    @Nested
    @DisplayName("Hints Naming Relations")
    class RelationTargetTests {

        @Test
        @DisplayName("Only the named relation is hinted")
        void testNamedTable() {
            LogicalPlan result = rule.apply(hint("MERGE", innerJoin(orders(), customers()), "orders"));

            assertThat(result).isEqualTo(innerJoin(resolved(JoinStrategyHint.SHUFFLE_MERGE, orders()), customers()));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("Qualified names and name-part lists are accepted")
        void testQualifiedNames() {
            LogicalPlan expected = innerJoin(orders(), resolved(JoinStrategyHint.SHUFFLE_HASH, customers()));

            assertThat(rule.apply(hint("SHUFFLE_HASH", innerJoin(orders(), customers()), "sales.customers")))
                .isEqualTo(expected);
            assertThat(rule.apply(hint("SHUFFLE_HASH", innerJoin(orders(), customers()), List.of("sales", "customers"))))
                .isEqualTo(expected);
        }

        @Test
        @DisplayName("Aliases are matched, but relations inside an alias are out of scope")
        void testAliasScope() {
            LogicalPlan plan = innerJoin(alias(orders(), "o"), alias(customers(), "c"));

            LogicalPlan byAlias = rule.apply(hint("BROADCAST", plan, "c"));
            assertThat(byAlias).isEqualTo(
                innerJoin(alias(orders(), "o"), resolved(JoinStrategyHint.BROADCAST, alias(customers(), "c"))));

            LogicalPlan byHiddenName = rule.apply(hint("BROADCAST", plan, "orders"));
            assertThat(byHiddenName).isEqualTo(plan);
            assertThat(handler.relationsNotFound).hasSize(1);
            assertThat(handler.relationsNotFound.get(0).invalidRelations()).containsExactly(List.of("orders"));
        }

        @Test
        @DisplayName("Every occurrence of a named relation is hinted")
        void testSelfJoin() {
            LogicalPlan result = rule.apply(hint("BROADCAST", innerJoin(orders(), orders()), "orders"));

            assertThat(result).isEqualTo(innerJoin(
                resolved(JoinStrategyHint.BROADCAST, orders()),
                resolved(JoinStrategyHint.BROADCAST, orders())));
        }

        @Test
        @DisplayName("Names matching nothing are reported once, together")
        void testRelationsNotFound() {
            LogicalPlan result = rule.apply(
                hint("BROADCAST", innerJoin(orders(), customers()), "orders", "missing", "db.other"));

            assertThat(result).isEqualTo(innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers()));
            assertThat(handler.relationsNotFound).hasSize(1);

            RecordingHintErrorHandler.RelationsNotFound report = handler.relationsNotFound.get(0);
            assertThat(report.name()).isEqualTo("BROADCAST");
            assertThat(report.parameters()).containsExactly("orders", "missing", "db.other");
            assertThat(report.invalidRelations()).isEqualTo(Set.of(List.of("missing"), List.of("db", "other")));
        }

        @Test
        @DisplayName("Relation names follow the case sensitivity setting")
        void testCaseSensitivity() {
            LogicalPlan plan = innerJoin(orders(), customers());

            assertThat(rule.apply(hint("BROADCAST", plan, "ORDERS")))
                .isEqualTo(innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers()));

            ResolveJoinStrategyHints caseSensitive =
                new ResolveJoinStrategyHints(HintConf.defaults().withCaseSensitive(true), handler);
            assertThat(caseSensitive.apply(hint("BROADCAST", plan, "ORDERS"))).isEqualTo(plan);
            assertThat(handler.relationsNotFound).hasSize(1);
        }

        @Test
        @DisplayName("An outer hint on an already hinted relation wins and overrides the inner one")
        void testNestedHintsMerge() {
            LogicalPlan plan = hint("BROADCAST",
                hint("SHUFFLE_HASH", innerJoin(orders(), customers()), "orders"),
                "orders");

            LogicalPlan result = rule.apply(plan);

            assertThat(result).isEqualTo(innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers()));
            assertThat(handler.overridden).containsExactly(HintInfo.of(JoinStrategyHint.SHUFFLE_HASH));
        }

        @Test
        @DisplayName("Relations below a hint on a whole subtree can still be named")
        void testBelowSubtreeHint() {
            LogicalPlan plan = hint("BROADCAST",
                hint("MERGE", innerJoin(orders(), customers())),
                "orders");

            LogicalPlan result = rule.apply(plan);

            assertThat(result).isEqualTo(resolved(JoinStrategyHint.SHUFFLE_MERGE,
                innerJoin(resolved(JoinStrategyHint.BROADCAST, orders()), customers())));
            assertThat(handler.relationsNotFound).isEmpty();
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("A hinted relation with another name is left as it is")
        void testOtherHintedRelation() {
            LogicalPlan plan = innerJoin(resolved(JoinStrategyHint.SHUFFLE_HASH, orders()), customers());

            LogicalPlan result = rule.apply(hint("BROADCAST", plan, "customers"));

            assertThat(result).isEqualTo(innerJoin(
                resolved(JoinStrategyHint.SHUFFLE_HASH, orders()),
                resolved(JoinStrategyHint.BROADCAST, customers())));
            assertThat(handler.totalCallbacks()).isZero();
        }

        @Test
        @DisplayName("Parameters of other types fail analysis")
        void testUnsupportedParameter() {
            assertThatThrownBy(() -> rule.apply(hint("BROADCAST", orders(), 42)))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("should be an identifier or string but was 42 (Integer)");
            assertThatThrownBy(() -> rule.apply(hint("BROADCAST", orders(), "a..b")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Invalid relation name 'a..b'");
        }
    }
}
