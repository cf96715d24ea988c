package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * How newly extracted invoice amounts combine with an amount already recorded for a day.
 */
public enum MergeStrategy {

    /** Sum of the incoming amounts when exactly one amount arrives, otherwise added to the existing amount. */
    SMART {
        @Override
        public Money merge(Money existing, List<Money> incoming) {
            Money sum = sum(incoming);
            return incoming.size() == 1 ? sum : existing.add(sum);
        }
    },
    ADD {
        @Override
        public Money merge(Money existing, List<Money> incoming) {
            return existing.add(sum(incoming));
        }
    },
    REPLACE {
        @Override
        public Money merge(Money existing, List<Money> incoming) {
            return sum(incoming);
        }
    },
    MAX {
        @Override
        public Money merge(Money existing, List<Money> incoming) {
            return existing.max(sum(incoming));
        }
    };

    /**
     * Combines the amounts.
     *
     * @param existing amount already recorded, {@link Money#ZERO} when none
     * @param incoming newly extracted amounts for the same day
     * @return merged amount
     */
    public abstract Money merge(Money existing, List<Money> incoming);

    private static Money sum(List<Money> amounts) {
        return amounts.stream().reduce(Money.ZERO, Money::add);
    }
}
