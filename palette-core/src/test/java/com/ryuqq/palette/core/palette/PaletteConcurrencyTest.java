package com.ryuqq.palette.core.palette;

import com.ryuqq.palette.core.color.Color;
import com.ryuqq.palette.core.exception.CycleException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 동시 첫 접근 테스트.
 *
 * <p>여러 스레드가 동시에 해석을 유발해도 모두 같은 결과(같은 Color 인스턴스)를 관찰해야 하고,
 * 실패하는 팔레트는 모든 스레드에서 같은 예외로 실패해야 합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
class PaletteConcurrencyTest {

    private static final int THREADS = 16;

    @Test
    void 동시_첫_접근_시_모든_스레드가_같은_Color_인스턴스를_관찰함() throws Exception {
        // given
        Map<String, Object> literals = new LinkedHashMap<>();
        literals.put("base", "#336699");
        for (int i = 0; i < 200; i++) {
            literals.put("alias" + i, i == 0 ? "base" : "alias" + (i - 1));
        }
        Palette palette = Palette.fromLiterals(literals);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Color>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return palette.get("alias199");
                }));
            }
            start.countDown();

            // then
            Color expected = palette.get("base");
            for (Future<Color> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 동시_첫_접근_시_순환_팔레트는_모든_스레드에서_CycleException() throws Exception {
        // given
        Map<String, Object> literals = new LinkedHashMap<>();
        literals.put("a", "b");
        literals.put("b", "a");
        Palette palette = Palette.fromLiterals(literals);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Throwable>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        palette.names();
                        return null;
                    } catch (CycleException e) {
                        return e;
                    }
                }));
            }
            start.countDown();

            // then
            for (Future<Throwable> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(CycleException.class)
                    .hasMessage("looping at b");
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
