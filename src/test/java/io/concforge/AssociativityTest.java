package io.concforge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Left- and right-folded chains of the same leaves must evaluate to the same outcome.
 *
 * <p>Leaves finish after distinct delays spaced far apart, so the order in which they complete
 * (and therefore which failure is first and which success wins) is known up front.
 */
class AssociativityTest {

    private static final long SPACING_MILLIS = 40L;

    @Test
    void andChainsAreAssociative() {
        for (long seed = 1L; seed <= 6L; seed++) {
            List<LeafPlan> plans = randomPlans(new Random(seed));
            try (ConcRuntime runtime = ConcRuntime.create()) {
                String left = outcome(runtime, foldLeft(leaves(plans), concat()));
                String right = outcome(runtime, foldRight(leaves(plans), concat()));
                assertEquals(expectedAnd(plans), left, "left fold, seed " + seed);
                assertEquals(expectedAnd(plans), right, "right fold, seed " + seed);
            }
        }
    }

    @Test
    void orChainsAreAssociative() {
        for (long seed = 11L; seed <= 16L; seed++) {
            List<LeafPlan> plans = randomPlans(new Random(seed));
            try (ConcRuntime runtime = ConcRuntime.create()) {
                String left = outcome(runtime, foldLeftOr(leaves(plans)));
                String right = outcome(runtime, foldRightOr(leaves(plans)));
                assertEquals(expectedOr(plans), left, "left fold, seed " + seed);
                assertEquals(expectedOr(plans), right, "right fold, seed " + seed);
            }
        }
    }

    @Test
    void emptyIsTheIdentityOfOrInAnyPosition() {
        try (ConcRuntime runtime = ConcRuntime.create()) {
            Conc<String> value = Conc.pure("x");
            assertEquals("x", runtime.runConc(value.or(Conc.<String>empty())));
            assertEquals("x", runtime.runConc(Conc.<String>empty().or(value)));
            assertEquals("x", runtime.runConc(Conc.<String>empty().or(Conc.<String>empty().or(value))));
            assertEquals("x", runtime.runConc(Conc.<String>empty().or(Conc.<String>empty()).or(value)));
        }
    }

    private static List<LeafPlan> randomPlans(Random random) {
        int size = 2 + random.nextInt(4);
        List<Integer> ranks = new ArrayList<Integer>();
        for (int i = 0; i < size; i++) {
            ranks.add(i + 1);
        }
        Collections.shuffle(ranks, random);
        List<LeafPlan> plans = new ArrayList<LeafPlan>();
        for (int i = 0; i < size; i++) {
            plans.add(new LeafPlan("leaf" + i, ranks.get(i), random.nextBoolean()));
        }
        return plans;
    }

    private static String outcome(ConcRuntime runtime, Conc<String> tree) {
        try {
            return "ok:" + runtime.runConc(tree);
        } catch (IllegalStateException e) {
            return "failed:" + e.getMessage();
        }
    }

    private static String expectedAnd(List<LeafPlan> plans) {
        LeafPlan firstFailure = null;
        StringBuilder joined = new StringBuilder();
        for (LeafPlan plan : plans) {
            if (plan.fails && (firstFailure == null || plan.rank < firstFailure.rank)) {
                firstFailure = plan;
            }
            joined.append(plan.name);
        }
        return firstFailure == null ? "ok:" + joined : "failed:" + firstFailure.name;
    }

    private static String expectedOr(List<LeafPlan> plans) {
        LeafPlan firstSuccess = null;
        LeafPlan firstFailure = null;
        for (LeafPlan plan : plans) {
            if (!plan.fails && (firstSuccess == null || plan.rank < firstSuccess.rank)) {
                firstSuccess = plan;
            }
            if (plan.fails && (firstFailure == null || plan.rank < firstFailure.rank)) {
                firstFailure = plan;
            }
        }
        return firstSuccess != null ? "ok:" + firstSuccess.name : "failed:" + firstFailure.name;
    }

    private static List<Conc<String>> leaves(List<LeafPlan> plans) {
        List<Conc<String>> leaves = new ArrayList<Conc<String>>();
        for (LeafPlan plan : plans) {
            leaves.add(leaf(plan));
        }
        return leaves;
    }

    private static Conc<String> leaf(final LeafPlan plan) {
        return Conc.conc(plan.name, new Callable<String>() {
            @Override
            public String call() throws Exception {
                Thread.sleep(plan.rank * SPACING_MILLIS);
                if (plan.fails) {
                    throw new IllegalStateException(plan.name);
                }
                return plan.name;
            }
        });
    }

    private static BiFunction<String, String, String> concat() {
        return new BiFunction<String, String, String>() {
            @Override
            public String apply(String left, String right) {
                return left + right;
            }
        };
    }

    private static Conc<String> foldLeft(List<Conc<String>> items, BiFunction<String, String, String> combine) {
        Conc<String> acc = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            acc = acc.zipWith(items.get(i), combine);
        }
        return acc;
    }

    private static Conc<String> foldRight(List<Conc<String>> items, BiFunction<String, String, String> combine) {
        Conc<String> acc = items.get(items.size() - 1);
        for (int i = items.size() - 2; i >= 0; i--) {
            acc = items.get(i).zipWith(acc, combine);
        }
        return acc;
    }

    private static Conc<String> foldLeftOr(List<Conc<String>> items) {
        Conc<String> acc = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            acc = acc.or(items.get(i));
        }
        return acc;
    }

    private static Conc<String> foldRightOr(List<Conc<String>> items) {
        Conc<String> acc = items.get(items.size() - 1);
        for (int i = items.size() - 2; i >= 0; i--) {
            acc = items.get(i).or(acc);
        }
        return acc;
    }

    private static final class LeafPlan {

        final String name;
        final int rank;
        final boolean fails;

        LeafPlan(String name, int rank, boolean fails) {
            this.name = name;
            this.rank = rank;
            this.fails = fails;
        }

        @Override
        public String toString() {
            return name + "(rank=" + rank + (fails ? ", fails" : "") + ")";
        }
    }
}
