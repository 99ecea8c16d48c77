package com.ryuqq.decider.application.support;

import com.ryuqq.decider.core.outcome.Failure;
import com.ryuqq.decider.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * 배치 입력 처리기.
 *
 * <p>입력마다 하나의 Outcome을 만들며, 한 항목의 실패가 다른 항목 처리를 막지 않습니다.
 * 입력 자체를 더 이상 읽을 수 없으면 PublishingFailed를 하나 추가하고 멈춥니다.
 * 처리 함수가 항목을 거부하면(null 항목 등) 그 항목만 PublishingFailed가 되고 다음 항목을 계속 처리합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class Batches {

    private Batches() {
    }

    /**
     * 각 입력을 순서대로 처리.
     *
     * @param inputs 입력 시퀀스
     * @param handler 입력별 처리 함수
     * @param <I> 입력 타입
     * @param <T> 결과 타입
     * @return 입력 순서대로의 Outcome 목록
     */
    public static <I, T> List<Outcome<T>> each(Iterable<? extends I> inputs, Function<? super I, Outcome<T>> handler) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        List<Outcome<T>> results = new ArrayList<>();
        Iterator<? extends I> iterator;
        try {
            iterator = inputs.iterator();
        } catch (RuntimeException e) {
            results.add(Outcome.fail(new Failure.PublishingFailed(e)));
            return results;
        }
        while (true) {
            I input;
            try {
                if (!iterator.hasNext()) {
                    return results;
                }
                input = iterator.next();
            } catch (RuntimeException e) {
                results.add(Outcome.fail(new Failure.PublishingFailed(e)));
                return results;
            }
            results.add(dispatch(input, handler));
        }
    }

    private static <I, T> Outcome<T> dispatch(I input, Function<? super I, Outcome<T>> handler) {
        try {
            return handler.apply(input);
        } catch (RuntimeException e) {
            return Outcome.fail(new Failure.PublishingFailed(e));
        }
    }
}
