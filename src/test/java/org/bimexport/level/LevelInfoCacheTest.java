package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bimexport.level.TestModels.id;
import static org.bimexport.level.TestModels.nonStory;
import static org.bimexport.level.TestModels.story;
import static org.bimexport.level.TestModels.storyWithDefaultHeight;

class LevelInfoCacheTest {

    private final BuildingModel model = TestModels.model(List.of(
            story(1, 0.0),
            nonStory(2, 5.0),
            storyWithDefaultHeight(3, 10.0, 4.0)
    ));

    @Test
    void register_firstHeightWins() {
        LevelInfoCache cache = new LevelInfoCache(model);

        cache.register(id(1), id(3), 10.0);
        cache.register(id(1), ElementId.INVALID, 7.5);

        assertThat(cache.findHeight(id(1))).hasValue(10.0);
        assertThat(cache.findNextLevel(id(1))).isEqualTo(id(3));
    }

    @Test
    void register_sameHeightTwiceIsIdempotent() {
        LevelInfoCache cache = new LevelInfoCache(model);

        LevelInfo first = cache.register(id(1), id(3), 10.0);
        LevelInfo second = cache.register(id(1), id(3), 10.0);

        assertThat(second).isEqualTo(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void register_negativeHeightLeavesHeightUnknown() {
        LevelInfoCache cache = new LevelInfoCache(model);

        cache.register(id(1), ElementId.INVALID, -2.0);

        assertThat(cache.findHeight(id(1))).isEmpty();
        assertThat(cache.getLevelInfo(id(1))).isNotNull();
    }

    @Test
    void register_unknownLevelIsIgnored() {
        LevelInfoCache cache = new LevelInfoCache(model);

        assertThat(cache.register(id(99), ElementId.INVALID, 3.0)).isNull();
        assertThat(cache.getLevelInfo(id(99))).isNull();
        assertThat(cache.findNextLevel(id(99))).isEqualTo(ElementId.INVALID);
    }

    @Test
    void findHeight_isEmptyUntilRegistered() {
        LevelInfoCache cache = new LevelInfoCache(model);

        LevelInfo created = cache.getOrCreateLevelInfo(id(3));

        assertThat(created.elevation()).isEqualTo(10.0);
        assertThat(created.defaultHeight()).isEqualTo(4.0);
        assertThat(created.isHeightKnown()).isFalse();
        assertThat(cache.findHeight(id(3))).isEmpty();
        assertThat(cache.findNextLevel(id(3))).isEqualTo(ElementId.INVALID);
    }

    @Test
    void getLevelInfo_doesNotCreateEntries() {
        LevelInfoCache cache = new LevelInfoCache(model);

        assertThat(cache.getLevelInfo(id(1))).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    void getBuildingStoriesByElevation_filtersNonStories() {
        LevelInfoCache cache = new LevelInfoCache(model);

        assertThat(cache.getBuildingStoriesByElevation()).containsExactly(id(1), id(3));
        assertThat(cache.getBuildingStoriesByElevation()).isSameAs(cache.getBuildingStoriesByElevation());
    }

    @Test
    void register_concurrentWritersAgreeOnOneHeight() throws Exception {
        LevelInfoCache cache = new LevelInfoCache(model);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<LevelInfo>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                double height = 1.0 + i;
                tasks.add(() -> cache.register(id(1), ElementId.INVALID, height));
            }
            List<Double> observed = new ArrayList<>();
            for (Future<LevelInfo> future : executor.invokeAll(tasks)) {
                observed.add(future.get().heightToNextLevel());
            }

            double winner = cache.findHeight(id(1)).getAsDouble();
            assertThat(observed).containsOnly(winner);
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
