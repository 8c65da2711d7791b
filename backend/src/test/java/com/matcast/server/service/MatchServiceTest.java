package com.matcast.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;

import com.matcast.server.dto.EventsPage;
import com.matcast.server.dto.MatchEventView;
import com.matcast.server.dto.MatchMutation;
import com.matcast.server.exception.InvalidMatchStateException;
import com.matcast.server.exception.InvalidParticipantException;
import com.matcast.server.exception.InvalidTransitionException;
import com.matcast.server.exception.InvalidValueException;
import com.matcast.server.exception.MatchConflictException;
import com.matcast.server.exception.MatchNotFoundException;
import com.matcast.server.model.Match;
import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;
import com.matcast.server.model.MatchState;
import com.matcast.server.model.ScoreAction;
import com.matcast.server.support.MatchFixtures;
import com.matcast.server.support.MutableClock;

class MatchServiceTest {

    private MutableClock clock;
    private MatchFixtures fx;
    private MatchService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T10:00:00Z");
        fx = new MatchFixtures(clock);
        service = fx.service;
        fx.createMatch("m1", 300, null);
    }

    private void start() {
        service.transitionState("m1", MatchState.IN_PROGRESS, "ref");
    }

    @Nested
    @DisplayName("Score actions")
    class ScoreActions {

        @Test
        @DisplayName("POINTS_2 adds two points and records the score event")
        void pointsAreApplied() {
            start();

            MatchMutation result = service.applyScoreAction("m1", ScoreAction.POINTS_2, "p1", "ref");

            assertThat(result.snapshot().score1().points()).isEqualTo(2);
            assertThat(result.snapshot().score2().points()).isZero();
            assertThat(result.autoFinished()).isFalse();

            List<MatchEvent> scoreEvents = fx.eventsOf("m1", MatchEventType.POINTS_2);
            assertThat(scoreEvents).hasSize(1);
            MatchEvent event = scoreEvents.get(0);
            assertThat(event.getActorId()).isEqualTo("ref");
            assertThat(event.getParticipantId()).isEqualTo("p1");
            assertThat(event.getMetadata()).containsKeys("action", "oldScore", "newScore", "scoreDifference");
            assertThat(event.getMetadata().get("action")).isEqualTo("POINTS_2");
        }

        @Test
        @DisplayName("Score actions outside IN_PROGRESS are rejected without side effects")
        void rejectedWhenNotInProgress() {
            int before = fx.events.size();

            assertThatThrownBy(() -> service.applyScoreAction("m1", ScoreAction.ADVANTAGE, "p1", "ref"))
                    .isInstanceOf(InvalidMatchStateException.class)
                    .hasMessageContaining("expected IN_PROGRESS");

            assertThat(fx.events).hasSize(before);
            assertThat(fx.matches.get("m1").getScore1().getAdvantages()).isZero();
        }

        @Test
        void unknownParticipantIsRejected() {
            start();

            assertThatThrownBy(() -> service.applyScoreAction("m1", ScoreAction.POINTS_2, "p9", "ref"))
                    .isInstanceOf(InvalidParticipantException.class);
            assertThat(fx.matches.get("m1").getScore1().getPoints()).isZero();
        }

        @Test
        void unknownMatchIsNotFound() {
            assertThatThrownBy(() -> service.applyScoreAction("nope", ScoreAction.POINTS_2, "p1", "ref"))
                    .isInstanceOf(MatchNotFoundException.class)
                    .hasMessage("Match not found: nope");
        }
    }

    @Nested
    @DisplayName("Auto-finish")
    class AutoFinish {

        @Test
        @DisplayName("A submission finishes the match for the submitting participant")
        void submissionFinishes() {
            start();

            MatchMutation result = service.applyScoreAction("m1", ScoreAction.SUBMISSION, "p1", "ref");

            assertThat(result.autoFinished()).isTrue();
            assertThat(result.snapshot().state()).isEqualTo(MatchState.FINISHED);
            assertThat(result.snapshot().winnerId()).isEqualTo("p1");
            assertThat(result.events()).extracting(MatchEventView::eventType)
                    .containsExactly(MatchEventType.SUBMISSION, MatchEventType.AUTO_FINISH);

            MatchEvent auto = fx.eventsOf("m1", MatchEventType.AUTO_FINISH).get(0);
            assertThat(auto.getActorId()).isEqualTo(MatchEventLog.SYSTEM_ACTOR);
            assertThat(auto.getMetadata().get("reason")).isEqualTo("Submission");
            assertThat(auto.getMetadata().get("winnerId")).isEqualTo("p1");
            assertThat(fx.metrics.snapshot().autoFinishedMatches()).isEqualTo(1);
        }

        @Test
        @DisplayName("The third penalty disqualifies and the opponent wins")
        void threePenaltiesDisqualify() {
            start();
            service.applyScoreAction("m1", ScoreAction.PENALTY, "p1", "ref");
            service.applyScoreAction("m1", ScoreAction.PENALTY, "p1", "ref");
            assertThat(fx.matches.get("m1").getState()).isEqualTo(MatchState.IN_PROGRESS);

            MatchMutation result = service.applyScoreAction("m1", ScoreAction.PENALTY, "p1", "ref");

            assertThat(result.autoFinished()).isTrue();
            assertThat(result.snapshot().winnerId()).isEqualTo("p2");
            assertThat(fx.eventsOf("m1", MatchEventType.AUTO_FINISH).get(0).getMetadata().get("reason"))
                    .isEqualTo("Disqualification");
        }

        @Test
        @DisplayName("Time running out on an even match is a draw")
        void timeExpiredDraw() {
            start();

            MatchMutation result = service.updateTimer("m1", 0, "ref");

            assertThat(result.autoFinished()).isTrue();
            assertThat(result.snapshot().state()).isEqualTo(MatchState.FINISHED);
            assertThat(result.snapshot().winnerId()).isNull();
            assertThat(fx.eventsOf("m1", MatchEventType.AUTO_FINISH).get(0).getMetadata().get("reason"))
                    .isEqualTo("Time expired");
        }

        @Test
        @DisplayName("Resuming a paused match whose time is up finishes it at once")
        void resumeWithNoTimeLeft() {
            start();
            service.transitionState("m1", MatchState.PAUSED, "ref");
            service.updateTimer("m1", 0, "ref");
            assertThat(fx.matches.get("m1").getState()).isEqualTo(MatchState.PAUSED);

            MatchMutation result = service.transitionState("m1", MatchState.IN_PROGRESS, "ref");

            assertThat(result.autoFinished()).isTrue();
            assertThat(result.snapshot().state()).isEqualTo(MatchState.FINISHED);
        }

        @Test
        @DisplayName("Racing submissions finish the match exactly once")
        void concurrentSubmissionsFinishOnce() throws Exception {
            start();
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    String participant = i % 2 == 0 ? "p1" : "p2";
                    results.add(pool.submit(() -> {
                        go.await();
                        try {
                            return service.applyScoreAction("m1", ScoreAction.SUBMISSION, participant, "ref")
                                    .autoFinished();
                        } catch (InvalidMatchStateException e) {
                            return false;
                        }
                    }));
                }
                go.countDown();

                int finished = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(10, TimeUnit.SECONDS)) {
                        finished++;
                    }
                }
                assertThat(finished).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }

            assertThat(fx.eventsOf("m1", MatchEventType.AUTO_FINISH)).hasSize(1);
            assertThat(fx.eventsOf("m1", MatchEventType.SUBMISSION)).hasSize(1);
            assertThat(fx.metrics.snapshot().autoFinishedMatches()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("State transitions")
    class Transitions {

        @Test
        void startEmitsStartEvent() {
            MatchMutation result = service.transitionState("m1", MatchState.IN_PROGRESS, "ref");

            assertThat(result.snapshot().state()).isEqualTo(MatchState.IN_PROGRESS);
            MatchEvent start = fx.eventsOf("m1", MatchEventType.START).get(0);
            assertThat(start.getMetadata()).containsEntry("oldState", "SCHEDULED").containsEntry("newState", "IN_PROGRESS");
        }

        @Test
        void pauseEmitsStopEvent() {
            start();
            service.transitionState("m1", MatchState.PAUSED, "ref");

            assertThat(fx.eventsOf("m1", MatchEventType.STOP)).hasSize(1);
        }

        @Test
        void cancelEmitsGenericStateChange() {
            service.transitionState("m1", MatchState.CANCELLED, "ref");

            assertThat(fx.eventsOf("m1", MatchEventType.STATE_CHANGE)).hasSize(1);
        }

        @Test
        @DisplayName("Edges missing from the table are rejected and leave the state alone")
        void invalidEdgeRejected() {
            assertThatThrownBy(() -> service.transitionState("m1", MatchState.FINISHED, "ref"))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessage("Invalid state transition from SCHEDULED to FINISHED");
            assertThat(fx.matches.get("m1").getState()).isEqualTo(MatchState.SCHEDULED);
        }

        @Test
        void terminalStatesAreFinal() {
            start();
            service.transitionState("m1", MatchState.FINISHED, "ref");

            for (MatchState target : MatchState.values()) {
                assertThatThrownBy(() -> service.transitionState("m1", target, "ref"))
                        .isInstanceOf(InvalidTransitionException.class);
            }
        }
    }

    @Nested
    @DisplayName("Timer")
    class Timer {

        @Test
        void negativeTimeIsRejected() {
            start();

            assertThatThrownBy(() -> service.updateTimer("m1", -1, "ref"))
                    .isInstanceOf(InvalidValueException.class)
                    .hasMessage("Time remaining cannot be negative");
            assertThat(fx.matches.get("m1").getTimeRemaining()).isEqualTo(300);
        }

        @Test
        @DisplayName("Timer updates outside IN_PROGRESS are stored without finishing")
        void acceptedWhenScheduled() {
            MatchMutation result = service.updateTimer("m1", 0, "ref");

            assertThat(result.autoFinished()).isFalse();
            assertThat(result.snapshot().timeRemaining()).isZero();
            assertThat(result.snapshot().state()).isEqualTo(MatchState.SCHEDULED);

            MatchEvent timer = fx.eventsOf("m1", MatchEventType.TIMER_UPDATE).get(0);
            assertThat(timer.getValue()).isZero();
            assertThat(timer.getMetadata()).containsEntry("timeChange", -300);
        }
    }

    @Nested
    @DisplayName("Lifecycle helpers and queries")
    class Lifecycle {

        @Test
        void createdMatchStartsScheduledWithFullTime() {
            Match m = fx.matches.get("m1");

            assertThat(m.getState()).isEqualTo(MatchState.SCHEDULED);
            assertThat(m.getTimeRemaining()).isEqualTo(300);
            assertThat(fx.eventsOf("m1", MatchEventType.MATCH_CREATED)).hasSize(1);
        }

        @Test
        void duplicateIdIsRejected() {
            assertThatThrownBy(() -> fx.createMatch("m1", 300, null))
                    .isInstanceOf(InvalidValueException.class)
                    .hasMessageContaining("already exists");
        }

        @Test
        void assignRefereeRecordsComment() {
            MatchMutation result = service.assignReferee("m1", "r7", "Rita", "organizer");

            assertThat(result.snapshot().referee().id()).isEqualTo("r7");
            MatchEvent comment = fx.eventsOf("m1", MatchEventType.COMMENT).get(0);
            assertThat(comment.getMetadata()).containsEntry("newRefereeId", "r7");
        }

        @Test
        void getMatchOfUnknownIdThrows() {
            assertThatThrownBy(() -> service.getMatch("missing")).isInstanceOf(MatchNotFoundException.class);
            assertThat(service.findMatch("missing")).isEmpty();
        }

        @Test
        @DisplayName("Events are listed newest first, with offset and type filter")
        void listEventsNewestFirst() {
            clock.advance(Duration.ofSeconds(1));
            start();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofSeconds(1));
                service.applyScoreAction("m1", ScoreAction.POINTS_2, "p1", "ref");
            }
            clock.advance(Duration.ofSeconds(1));
            service.applyScoreAction("m1", ScoreAction.ADVANTAGE, "p2", "ref");

            EventsPage page = service.listEvents("m1", null, 2, 0);
            assertThat(page.total()).isEqualTo(6);
            assertThat(page.events()).extracting(MatchEventView::eventType)
                    .containsExactly(MatchEventType.ADVANTAGE, MatchEventType.POINTS_2);

            EventsPage tail = service.listEvents("m1", null, 10, 4);
            assertThat(tail.events()).extracting(MatchEventView::eventType)
                    .containsExactly(MatchEventType.START, MatchEventType.MATCH_CREATED);

            EventsPage points = service.listEvents("m1", MatchEventType.POINTS_2, 50, 0);
            assertThat(points.events()).hasSize(3)
                    .allMatch(e -> e.eventType() == MatchEventType.POINTS_2);
        }

        @Test
        @DisplayName("Unaligned offsets read two size-bounded pages, never offset plus limit rows")
        void unalignedOffsetReadsTwoPages() {
            start();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofSeconds(1));
                service.applyScoreAction("m1", ScoreAction.POINTS_2, "p1", "ref");
            }
            clock.advance(Duration.ofSeconds(1));
            service.applyScoreAction("m1", ScoreAction.ADVANTAGE, "p2", "ref");

            EventsPage page = service.listEvents("m1", null, 2, 3);

            assertThat(page.offset()).isEqualTo(3);
            assertThat(page.events()).extracting(MatchEventView::eventType)
                    .containsExactly(MatchEventType.POINTS_2, MatchEventType.START);
            verify(fx.eventRepository).findByMatchIdOrderByTimestampDesc("m1", PageRequest.of(1, 2));
            verify(fx.eventRepository).findByMatchIdOrderByTimestampDesc("m1", PageRequest.of(2, 2));
            verify(fx.eventRepository, never()).findByMatchIdOrderByTimestampDesc(
                    eq("m1"), argThat(p -> p.getPageSize() > 2));
        }

        @Test
        void offsetPastTheEndIsAnEmptyPageWithoutQuerying() {
            start();

            EventsPage past = service.listEvents("m1", null, 50, 2);
            EventsPage huge = service.listEvents("m1", MatchEventType.START, 50, Integer.MAX_VALUE);

            assertThat(past.events()).isEmpty();
            assertThat(past.total()).isEqualTo(2);
            assertThat(huge.events()).isEmpty();
            assertThat(huge.offset()).isEqualTo(Integer.MAX_VALUE);
            verify(fx.eventRepository, never()).findByMatchIdOrderByTimestampDesc(anyString(), any());
            verify(fx.eventRepository, never()).findByMatchIdAndEventTypeOrderByTimestampDesc(
                    anyString(), any(), any());
        }

        @Test
        void purgeLeavesOnlyThePurgeRecord() {
            start();
            service.applyScoreAction("m1", ScoreAction.POINTS_2, "p1", "ref");

            MatchEventView purged = service.purgeEvents("m1", "admin");

            assertThat(purged.eventType()).isEqualTo(MatchEventType.EVENTS_PURGED);
            assertThat(purged.value()).isEqualTo(3);
            assertThat(fx.events).hasSize(1);
            assertThat(fx.events.get(0).getEventType()).isEqualTo(MatchEventType.EVENTS_PURGED);
        }
    }

    @Test
    @DisplayName("Losing an optimistic version check surfaces as a retryable conflict")
    void optimisticLockFailureBecomesConflict() {
        start();
        when(fx.matchRepository.saveAndFlush(any(Match.class)))
                .thenThrow(new OptimisticLockingFailureException("stale version"));

        assertThatThrownBy(() -> service.applyScoreAction("m1", ScoreAction.POINTS_2, "p1", "ref"))
                .isInstanceOf(MatchConflictException.class)
                .hasMessage("Match was modified concurrently, please retry");
    }
}
