package com.aldar.middleware.transcript;

import com.aldar.middleware.model.CanonicalMessage;
import com.aldar.middleware.model.MessageRole;
import com.aldar.middleware.model.MessageSource;
import com.aldar.middleware.model.RunRecord;
import com.aldar.middleware.model.RunSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aldar.middleware.transcript.TranscriptFixtures.SESSION_ID;
import static com.aldar.middleware.transcript.TranscriptFixtures.T0;
import static com.aldar.middleware.transcript.TranscriptFixtures.childRun;
import static com.aldar.middleware.transcript.TranscriptFixtures.run;
import static com.aldar.middleware.transcript.TranscriptFixtures.teamRun;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RunLogNormalizerTest {

    private final RunLogNormalizer normalizer = new RunLogNormalizer();

    @Test
    void eachRunShouldYieldUserThenAssistant() {
        NormalizedRunLog result = normalizer.normalize(SESSION_ID, List.of(run("run-1", T0, "hi", "hello")));

        assertThat(result.messages()).extracting(CanonicalMessage::role)
                .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
        CanonicalMessage user = result.messages().get(0);
        assertThat(user.messageId()).isEqualTo(MessageIdentity.assign(SESSION_ID, "run-1", MessageRole.USER, "hi", T0));
        assertThat(user.runId()).isEqualTo("run-1");
        assertThat(user.agentName()).isEqualTo("Main Agent");
        assertThat(user.source()).isEqualTo(MessageSource.RUN_LOG);
        assertThat(result.messages().get(1).content()).isEqualTo("hello");
        assertThat(result.latestRunTimestamp()).isEqualTo(T0);
    }

    @Test
    void blankFieldsShouldNotProduceMessagesButSummaryIsKept() {
        NormalizedRunLog result = normalizer.normalize(SESSION_ID, List.of(
                run("run-1", T0, "  ", "answer"),
                run("run-2", T0.plusSeconds(30), null, null)
        ));

        assertThat(result.messages()).hasSize(1);
        assertThat(result.messages().get(0).role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(result.summaries()).extracting(RunSummary::runId, RunSummary::messageCount)
                .containsExactly(
                        tuple("run-1", 1),
                        tuple("run-2", 0)
                );
    }

    @Test
    void childRunsShouldBeSummarizedButNotRendered() {
        NormalizedRunLog result = normalizer.normalize(SESSION_ID, List.of(
                teamRun("run-parent", T0, "What is the weather?", "It is sunny"),
                childRun("run-child", "run-parent", T0.plusSeconds(2), "agent-weather", "Weather", "sunny, 25C")
        ));

        assertThat(result.messages()).extracting(CanonicalMessage::runId).containsOnly("run-parent");
        assertThat(result.summaries()).hasSize(2);
        assertThat(result.childRunIds("run-parent")).containsExactly("run-child");
        RunSummary child = result.summaries().stream()
                .filter(summary -> summary.runId().equals("run-child"))
                .findFirst()
                .orElseThrow();
        assertThat(child.parentRunId()).isEqualTo("run-parent");
        assertThat(child.messageCount()).isZero();
    }

    @Test
    void parentOutsideFetchedRunsShouldNotMakeRunAChild() {
        RunRecord orphan = childRun("run-orphan", "run-elsewhere", T0, "agent-x", "X", "still shown");

        NormalizedRunLog result = normalizer.normalize(SESSION_ID, List.of(orphan));

        assertThat(result.messages()).hasSize(1);
        assertThat(result.messages().get(0).content()).isEqualTo("still shown");
    }

    @Test
    void runsShouldBeOrderedByCreatedAt() {
        NormalizedRunLog result = normalizer.normalize(SESSION_ID, List.of(
                run("run-late", T0.plusSeconds(60), "second", "second answer"),
                run("run-early", T0, "first", "first answer")
        ));

        assertThat(result.messages()).extracting(CanonicalMessage::content)
                .containsExactly("first", "first answer", "second", "second answer");
        assertThat(result.latestRunTimestamp()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void emptyRunLogShouldNormalizeToEmpty() {
        assertThat(normalizer.normalize(SESSION_ID, List.of()).isEmpty()).isTrue();
        assertThat(normalizer.normalize(SESSION_ID, null).latestRunTimestamp()).isNull();
    }
}
