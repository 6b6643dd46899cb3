package io.edgeway.core.admission;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AdmissionControllerTest {

    @Test
    void shouldRejectFourthConnectionForSameSessionAndAdmitAfterRelease() {
        AdmissionController admission = new AdmissionController(3, 100);

        for (int i = 0; i < 3; i++) {
            assertThat(admission.tryAdmit("user-a").accepted()).isTrue();
        }
        AdmitResult fourth = admission.tryAdmit("user-a");

        assertThat(fourth.accepted()).isFalse();
        assertThat(fourth.reason()).isEqualTo(AdmitResult.RejectReason.PER_SESSION_LIMIT);
        assertThat(admission.sessionCount("user-a")).isEqualTo(3);
        assertThat(admission.globalCount()).isEqualTo(3);

        admission.release("user-a");

        assertThat(admission.tryAdmit("user-a").accepted()).isTrue();
        assertThat(admission.globalCount()).isEqualTo(3);
    }

    @Test
    void shouldRejectWithGlobalReasonWhenServerIsFull() {
        AdmissionController admission = new AdmissionController(5, 2);

        assertThat(admission.tryAdmit("a").accepted()).isTrue();
        assertThat(admission.tryAdmit("b").accepted()).isTrue();
        AdmitResult third = admission.tryAdmit("c");

        assertThat(third.accepted()).isFalse();
        assertThat(third.reason()).isEqualTo(AdmitResult.RejectReason.GLOBAL_LIMIT);
        assertThat(admission.sessionCount("c")).isZero();
    }

    @Test
    void releaseShouldBeIdempotentAndNeverGoNegative() {
        AdmissionController admission = new AdmissionController(3, 10);
        admission.tryAdmit("user-a");

        assertThat(admission.release("user-a")).isTrue();
        assertThat(admission.release("user-a")).isFalse();
        assertThat(admission.release("never-seen")).isFalse();

        assertThat(admission.globalCount()).isZero();
        assertThat(admission.sessionCount("user-a")).isZero();
        assertThat(admission.snapshot().perSessionCount()).isEmpty();
    }

    @Test
    void blankSessionKeysShareTheAnonymousBucket() {
        AdmissionController admission = new AdmissionController(2, 10);

        admission.tryAdmit(null);
        admission.tryAdmit("  ");

        assertThat(admission.sessionCount("anonymous")).isEqualTo(2);
        assertThat(admission.tryAdmit("").accepted()).isFalse();
    }

    @Test
    void globalCountShouldEqualSumOfSessionCountsUnderConcurrency() throws Exception {
        AdmissionController admission = new AdmissionController(4, 50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int worker = 0; worker < 8; worker++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    ThreadLocalRandom random = ThreadLocalRandom.current();
                    for (int i = 0; i < 2_000; i++) {
                        String key = "session-" + random.nextInt(20);
                        if (random.nextBoolean()) {
                            admission.tryAdmit(key);
                        } else {
                            admission.release(key);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        AdmissionSnapshot snapshot = admission.snapshot();
        int sum = snapshot.perSessionCount().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(snapshot.globalCount()).isEqualTo(sum);
        assertThat(snapshot.globalCount()).isBetween(0, 50);
        assertThat(snapshot.perSessionCount().values()).allMatch(count -> count > 0 && count <= 4);
    }
}
