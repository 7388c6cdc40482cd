package com.ryuqq.ramify.engine;

/**
 * Stage accepting pagination.
 *
 * <p>Offset is applied before limit, regardless of call order.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public interface LimitedStage extends TerminalStage {

    /**
     * Keeps at most {@code count} results.
     *
     * @param count maximum number of results (0 이상)
     * @throws IllegalArgumentException count가 음수인 경우
     */
    LimitedStage limit(int count);

    /**
     * Skips the first {@code count} results.
     *
     * @param count number of results to skip (0 이상)
     * @throws IllegalArgumentException count가 음수인 경우
     */
    LimitedStage offset(int count);
}
