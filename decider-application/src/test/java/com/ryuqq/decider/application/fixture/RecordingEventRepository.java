package com.ryuqq.decider.application.fixture;

import com.ryuqq.decider.core.spi.EventRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * 단일 스트림 Event 저장소 테스트 더블.
 *
 * <p>모든 Command가 같은 스트림을 조회하며, {@code save(List)} 호출 횟수를 기록합니다.</p>
 *
 * @param <C> Command 타입
 * @param <E> Event 타입
 */
public class RecordingEventRepository<C, E> implements EventRepository<C, E> {

    private final List<E> events = new ArrayList<>();
    private int batchSaves;

    @SafeVarargs
    public final RecordingEventRepository<C, E> given(E... stored) {
        events.addAll(List.of(stored));
        return this;
    }

    @Override
    public List<E> fetchEvents(C command) {
        return List.copyOf(events);
    }

    @Override
    public E save(E event) {
        events.add(event);
        return event;
    }

    @Override
    public List<E> save(List<E> newEvents) {
        batchSaves++;
        events.addAll(newEvents);
        return List.copyOf(newEvents);
    }

    public List<E> events() {
        return List.copyOf(events);
    }

    public int batchSaves() {
        return batchSaves;
    }
}
