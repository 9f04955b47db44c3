package com.fintech.permits.integration;

import com.fintech.permits.dto.QueuePosition;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.QueueStatus;
import com.fintech.permits.exception.JobInProgressException;
import com.fintech.permits.scheduler.PermitJobDispatcher;
import com.fintech.permits.service.PermitJobQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Durable permit queue and the worker pool running against H2 and the mock issuance backend.
 */
class PermitQueueIntegrationTest extends PipelineIntegrationTestBase {

    @Autowired
    private PermitJobQueue jobQueue;

    @Autowired
    private PermitJobDispatcher dispatcher;

    @Nested
    @DisplayName("Permit generation")
    class Generation {

        @Test
        @DisplayName("Queued job runs to PERMIT_READY and records a metrics sample")
        void generatesPermit() {
            // Given
            Application application = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_1", "pi_1");
            assertThat(jobQueue.enqueue(application.getId())).isTrue();

            // When
            assertThat(dispatcher.dispatch()).isEqualTo(1);

            // Then
            Application ready = awaitJobFinished(application.getId());
            assertThat(ready.getStatus()).isEqualTo(ApplicationStatus.PERMIT_READY);
            assertThat(ready.getQueueStatus()).isEqualTo(QueueStatus.COMPLETED);
            assertThat(ready.getPermitArtifactLocation()).startsWith("permits/" + application.getId() + "/");
            assertThat(ready.getPermitExpiresAt()).isAfter(now().plusDays(29));
            assertThat(ready.getQueueAttempts()).isEqualTo(1);
            assertThat(ready.getQueueStartedAt()).isNotNull();
            assertThat(ready.getQueueCompletedAt()).isNotNull();

            assertThat(paymentEventRepository.findByApplicationIdOrderByIdAsc(application.getId()))
                    .extracting(PaymentEvent::getEventType)
                    .containsExactly(PaymentEvent.PERMIT_GENERATION_STARTED, PaymentEvent.PERMIT_READY);
            await().atMost(Duration.ofSeconds(5)).until(() -> sampleRepository.count() > 0);
        }

        @Test
        @DisplayName("Permanent rejection fails the application with the backend's reason")
        void permanentRejection() {
            Application application = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_2", "pi_2");
            mockIssuance.rejectPermanently(application.getId(), "Vehicle registration not found");
            jobQueue.enqueue(application.getId());

            dispatcher.dispatch();

            Application failed = awaitJobFinished(application.getId());
            assertThat(failed.getStatus()).isEqualTo(ApplicationStatus.FAILED);
            assertThat(failed.getQueueStatus()).isEqualTo(QueueStatus.FAILED);
            assertThat(failed.getFailureReason()).isEqualTo("Vehicle registration not found");
            assertThat(mockIssuance.getCallCount(application.getId())).isEqualTo(1);
        }

        @Test
        @DisplayName("Transient backend errors are retried within the job")
        void transientErrorsRetried() {
            Application application = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_3", "pi_3");
            mockIssuance.failTransiently(application.getId(), 2);
            jobQueue.enqueue(application.getId());

            dispatcher.dispatch();

            Application ready = awaitJobFinished(application.getId());
            assertThat(ready.getStatus()).isEqualTo(ApplicationStatus.PERMIT_READY);
            assertThat(ready.getQueueAttempts()).isEqualTo(3);
            assertThat(mockIssuance.getCallCount(application.getId())).isEqualTo(3);
        }

        @Test
        @DisplayName("Dispatch never claims more jobs than free workers")
        void respectsWorkerLimit() {
            mockIssuance.setLatencyMs(300);
            try {
                Application first = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_4", "pi_4");
                Application second = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_5", "pi_5");
                Application third = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_6", "pi_6");
                jobQueue.enqueue(first.getId());
                jobQueue.enqueue(second.getId());
                jobQueue.enqueue(third.getId());

                assertThat(dispatcher.dispatch()).isEqualTo(2);
                assertThat(dispatcher.dispatch()).isZero();
                assertThat(reload(third.getId()).getQueueStatus()).isEqualTo(QueueStatus.QUEUED);

                awaitJobFinished(first.getId());
                awaitJobFinished(second.getId());
                await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.getActiveWorkers() == 0);

                assertThat(dispatcher.dispatch()).isEqualTo(1);
                assertThat(awaitJobFinished(third.getId()).getStatus()).isEqualTo(ApplicationStatus.PERMIT_READY);
            } finally {
                mockIssuance.setLatencyMs(0);
            }
        }
    }

    @Nested
    @DisplayName("Queue operations")
    class QueueOperations {

        @Test
        @DisplayName("Enqueue is idempotent and only accepts paid applications")
        void enqueueIsIdempotent() {
            Application paid = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_10", "pi_10");
            Application unpaid = createApplication(ApplicationStatus.PENDING_PAYMENT, "ord_11", "pi_11");

            assertThat(jobQueue.enqueue(paid.getId())).isTrue();
            assertThat(jobQueue.enqueue(paid.getId())).isFalse();
            assertThat(jobQueue.enqueue(unpaid.getId())).isFalse();

            assertThat(reload(unpaid.getId()).getQueueStatus()).isNull();
            assertThat(jobQueue.snapshot().getQueued()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Higher priority runs first, FIFO within a priority")
        void claimsByPriorityThenAge() {
            // Given
            Application oldNormal = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_20", "pi_20");
            Application newNormal = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_21", "pi_21");
            Application urgent = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_22", "pi_22");

            jobQueue.enqueue(oldNormal.getId(), 0);
            clock.advance(Duration.ofSeconds(1));
            jobQueue.enqueue(newNormal.getId(), 0);
            clock.advance(Duration.ofSeconds(1));
            jobQueue.enqueue(urgent.getId(), 5);

            // Then
            assertThat(jobQueue.position(urgent.getId()).getPosition()).isEqualTo(1L);
            assertThat(jobQueue.position(oldNormal.getId()).getPosition()).isEqualTo(2L);
            QueuePosition last = jobQueue.position(newNormal.getId());
            assertThat(last.getPosition()).isEqualTo(3L);
            assertThat(last.getEstimatedWaitMs()).isPositive();

            List<Application> claimed = jobQueue.claimNext(3);
            assertThat(claimed).extracting(Application::getId)
                    .containsExactly(urgent.getId(), oldNormal.getId(), newNormal.getId());
            assertThat(claimed).allSatisfy(job -> assertThat(job.getQueueStatus()).isEqualTo(QueueStatus.PROCESSING));
        }

        @Test
        @DisplayName("Queued job can be cancelled and requeued; a running job cannot be cancelled")
        void cancelSemantics() {
            // Given
            Application queued = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_30", "pi_30");
            Application running = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_31", "pi_31");
            jobQueue.enqueue(running.getId(), 10);
            jobQueue.claimNext(1);
            jobQueue.enqueue(queued.getId());

            // When / Then
            assertThat(jobQueue.cancel(queued.getId())).isTrue();
            assertThat(reload(queued.getId()).getQueueStatus()).isEqualTo(QueueStatus.CANCELLED);
            assertThat(jobQueue.cancel(queued.getId())).isFalse();
            assertThat(jobQueue.enqueue(queued.getId())).isTrue();

            assertThatThrownBy(() -> jobQueue.cancel(running.getId()))
                    .isInstanceOf(JobInProgressException.class);
            assertThat(reload(running.getId()).getQueueStatus()).isEqualTo(QueueStatus.PROCESSING);
        }

        @Test
        @DisplayName("Position of a job not in the queue is zero")
        void positionOfFinishedJob() {
            Application application = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_40", "pi_40");

            QueuePosition position = jobQueue.position(application.getId());

            assertThat(position.getPosition()).isZero();
            assertThat(position.getQueueStatus()).isNull();
        }

        @Test
        @DisplayName("Running jobs without progress past the threshold are reported stuck")
        void findsStuckJobs() {
            Application application = createApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_50", "pi_50");
            jobQueue.enqueue(application.getId());

            assertThat(jobQueue.findStuck()).isEmpty();

            clock.advance(Duration.ofMinutes(61));
            assertThat(jobQueue.findStuck()).extracting(Application::getId).containsExactly(application.getId());
        }
    }

    private Application awaitJobFinished(Long applicationId) {
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> {
                    QueueStatus status = reload(applicationId).getQueueStatus();
                    return status == QueueStatus.COMPLETED || status == QueueStatus.FAILED;
                });
        return reload(applicationId);
    }
}
