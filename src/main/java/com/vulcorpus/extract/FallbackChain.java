package com.vulcorpus.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 有序回退链：按声明顺序逐条尝试规则，第一条既适用又取到值的规则胜出
 * 规则顺序本身就是优先级，可以通过 {@link #ruleNames()} 直接断言
 *
 * @param <I> 输入类型
 * @param <T> 结果类型
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public final class FallbackChain<I, T> {

    private final List<Rule<I, T>> rules;

    private FallbackChain(List<Rule<I, T>> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static <I, T> Builder<I, T> builder() {
        return new Builder<>();
    }

    public Optional<T> resolve(I input) {
        return resolveWithRule(input).map(Resolution::value);
    }

    /**
     * 同 {@link #resolve(Object)}，额外返回胜出规则的名称
     */
    public Optional<Resolution<T>> resolveWithRule(I input) {
        for (Rule<I, T> rule : rules) {
            if (!rule.applies().test(input)) {
                continue;
            }
            Optional<T> value = rule.accessor().apply(input);
            if (value.isPresent()) {
                return Optional.of(new Resolution<>(rule.name(), value.get()));
            }
        }
        return Optional.empty();
    }

    public List<String> ruleNames() {
        return rules.stream().map(Rule::name).collect(Collectors.toList());
    }

    public record Rule<I, T>(String name, Predicate<I> applies, Function<I, Optional<T>> accessor) {
    }

    public record Resolution<T>(String ruleName, T value) {
    }

    public static final class Builder<I, T> {

        private final List<Rule<I, T>> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder<I, T> rule(String name, Predicate<I> applies, Function<I, Optional<T>> accessor) {
            rules.add(new Rule<>(name, applies, accessor));
            return this;
        }

        /**
         * 总是适用的规则，只看能否取到值
         */
        public Builder<I, T> rule(String name, Function<I, Optional<T>> accessor) {
            return rule(name, input -> true, accessor);
        }

        public FallbackChain<I, T> build() {
            if (rules.isEmpty()) {
                throw new IllegalStateException("回退链至少需要一条规则");
            }
            return new FallbackChain<>(rules);
        }
    }
}
