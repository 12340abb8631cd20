package com.stagegate.core.collaborator;

import com.stagegate.core.RecordFixtures;
import com.stagegate.core.model.Stage;
import com.stagegate.core.store.RecordCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StageOutputCollectorTest {

    @TempDir
    Path runDir;

    private final RecordCodec codec = RecordFixtures.codec();
    private final StageOutputCollector collector = new StageOutputCollector(codec);

    @Test
    @DisplayName("output files are named after the stage occurrence")
    void fileName() {
        assertEquals(runDir.resolve("review_post_output.json"), collector.outputFile(runDir, Stage.REVIEW_POST));
    }

    @Test
    @DisplayName("collects a single record or an array of records")
    void collects() throws Exception {
        Files.writeString(collector.outputFile(runDir, Stage.REVIEW),
                codec.toJson(codec.toTree(RecordFixtures.review(Stage.REVIEW, true))));
        Files.writeString(collector.outputFile(runDir, Stage.LEARN),
                codec.toJson(codec.toTrees(List.of(RecordFixtures.skill("skills/a.md"), RecordFixtures.metrics("R-1")))));

        assertEquals(1, collector.collect(runDir, Stage.REVIEW).size());
        assertEquals(2, collector.collect(runDir, Stage.LEARN).size());
    }

    @Test
    @DisplayName("missing and unparseable files contribute nothing")
    void missingOrBroken() throws Exception {
        assertTrue(collector.collect(runDir, Stage.DISRUPT).isEmpty());

        Files.writeString(collector.outputFile(runDir, Stage.VALIDATE), "{not json");
        assertTrue(collector.collect(runDir, Stage.VALIDATE).isEmpty());
    }
}
