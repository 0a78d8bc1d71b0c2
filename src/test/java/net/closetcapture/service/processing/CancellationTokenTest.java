package net.closetcapture.service.processing;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void should_FireChild_When_AnyLinkedParentFires() {
        CancellationToken user = CancellationToken.create();
        CancellationToken screen = CancellationToken.create();
        CancellationToken run = CancellationToken.linkedTo(user, screen);

        screen.cancel();

        assertThat(run.isCancelled()).isTrue();
        assertThat(user.isCancelled()).isFalse();
    }

    @Test
    void should_FireImmediately_When_ParentAlreadyCancelled() {
        CancellationToken parent = CancellationToken.create();
        parent.cancel();

        assertThat(CancellationToken.linkedTo(parent).isCancelled()).isTrue();
    }

    @Test
    void should_RunCallbacksOnce_When_CancelledTwice() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(calls).hasValue(1);
    }

    @Test
    void should_CompleteSignal_When_SubscribedAfterFiring() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        StepVerifier.create(token.whenCancelled()).verifyComplete();
    }

    @Test
    void should_KeepFiringOtherListeners_When_OneCallbackThrows() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertThat(calls).hasValue(1);
    }

    @Test
    void should_DropParentListener_When_ChildDetached() {
        CancellationToken screen = CancellationToken.create();
        for (int i = 0; i < 50; i++) {
            CancellationToken run = CancellationToken.linkedTo(screen);
            run.detach();
        }

        assertThat(screen.listenerCount()).isZero();
    }

    @Test
    void should_DropParentListener_When_ChildFiresItself() {
        CancellationToken screen = CancellationToken.create();
        CancellationToken run = CancellationToken.linkedTo(screen);

        run.cancel();

        assertThat(screen.listenerCount()).isZero();
        assertThat(screen.isCancelled()).isFalse();
    }

    @Test
    void should_StillFireDirectly_When_Detached() {
        CancellationToken screen = CancellationToken.create();
        CancellationToken run = CancellationToken.linkedTo(screen);
        run.detach();

        screen.cancel();
        assertThat(run.isCancelled()).isFalse();

        assertThat(run.cancel()).isTrue();
        StepVerifier.create(run.whenCancelled()).verifyComplete();
    }
}
