package org.bimexport.level;

import org.bimexport.model.BuildingModel;
import org.bimexport.model.ElementId;
import org.bimexport.model.ElementKind;
import org.bimexport.model.ExportInfoPair;
import org.bimexport.model.Level;
import org.bimexport.model.LevelParameter;
import org.bimexport.model.ModelElement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.bimexport.level.TestModels.BEAM;
import static org.bimexport.level.TestModels.COLUMN;
import static org.bimexport.level.TestModels.DUCT;
import static org.bimexport.level.TestModels.WALL;
import static org.bimexport.level.TestModels.element;
import static org.bimexport.level.TestModels.id;
import static org.bimexport.level.TestModels.nonStory;
import static org.bimexport.level.TestModels.story;
import static org.bimexport.level.TestModels.storyWithDefaultHeight;

class LevelRangeSplitterTest {

    private static final double T = ExportOptions.DEFAULT_LEVEL_EXTENSION;

    private static ExportPass pass(List<Level> levels, ModelElement... elements) {
        return ExportPass.begin(TestModels.model(levels, elements), ExportOptions.defaults(), Map.of());
    }

    private static void assertOrderedAndDisjoint(LevelSplitResult result) {
        List<VerticalSpan> ranges = result.ranges();
        for (int i = 0; i < ranges.size(); i++) {
            assertThat(ranges.get(i).start()).isLessThan(ranges.get(i).end());
            if (i > 0) {
                assertThat(ranges.get(i).start()).isGreaterThanOrEqualTo(ranges.get(i - 1).start());
                assertThat(ranges.get(i - 1).end()).isLessThanOrEqualTo(ranges.get(i).start() + T);
            }
        }
    }

    @Test
    void split_singleStoryWithUnknownHeightClipsBelowElevation() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, -1.0, 5.0);
        ExportPass pass = pass(List.of(story(1, 0.0)), column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 5.0));
    }

    @Test
    void split_twoStoriesLinkedByUpToLevel() {
        ModelElement wall = element(100, ElementKind.WALL, WALL, -2.0, 15.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0)), wall);

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.levels()).containsExactly(id(1), id(2));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 10.0), new VerticalSpan(10.0, 15.0));
        assertThat(pass.levelInfoCache().findHeight(id(1))).hasValue(10.0);
        assertThat(pass.levelInfoCache().findNextLevel(id(1))).isEqualTo(id(2));
        assertThat(pass.levelInfoCache().findHeight(id(2))).hasValue(0.0);
    }

    @Test
    void split_disabledOptionReturnsEmpty() {
        ModelElement wall = element(100, ElementKind.WALL, WALL, -2.0, 15.0);
        BuildingModel model = TestModels.model(List.of(story(1, 0.0, 2), story(2, 10.0)), wall);
        ExportPass pass = ExportPass.begin(model, new ExportOptions(false, T), Map.of());

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.levels()).isEmpty();
        assertThat(result.ranges()).isEmpty();
        assertThat(pass.splitter().segment(wall, WALL, new VerticalSpan(-2.0, 15.0)).isEmpty()).isTrue();
    }

    @Test
    void split_spanInsideOneStoryIsNotClipped() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 2.0, 8.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0, 3), story(3, 20.0)), column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(2.0, 8.0));
    }

    @Test
    void split_overflowWithinToleranceStaysInOneStory() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 0.0, 10.2);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0)), column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 10.2));
    }

    @Test
    void split_startsAtBaseLevelAndKeepsPortionBelowIt() {
        List<Level> levels = List.of(story(1, 0.0, 2), story(2, 10.0, 3), story(3, 20.0, 4), story(4, 30.0));
        ModelElement wall = element(100, ElementKind.WALL, WALL, id(1),
                Map.of(LevelParameter.WALL_BASE_CONSTRAINT, id(2)), 5.0, 35.0);
        ExportPass pass = pass(levels, wall);

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.levels()).containsExactly(id(2), id(3), id(4));
        assertThat(result.ranges()).containsExactly(
                new VerticalSpan(5.0, 20.0),
                new VerticalSpan(20.0, 30.0),
                new VerticalSpan(30.0, 35.0)
        );
        assertThat(pass.levelInfoCache().getLevelInfo(id(1))).isNull();
    }

    @Test
    void split_singleFragmentOnBaseLevelKeepsPortionBelowIt() {
        List<Level> levels = List.of(story(1, 0.0, 2), story(2, 10.0, 3), story(3, 20.0));
        ModelElement wall = element(100, ElementKind.WALL, WALL, ElementId.INVALID,
                Map.of(LevelParameter.WALL_BASE_CONSTRAINT, id(2)), 5.0, 18.0);
        ExportPass pass = pass(levels, wall);

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.fragments()).containsExactly(new LevelFragment(id(2), new VerticalSpan(5.0, 18.0)));
    }

    @Test
    void split_bottomWithinToleranceOfLowestStoryIsNotClipped() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, -0.05, 9.9);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0)), column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(-0.05, 9.9));
    }

    @Test
    void split_upToLevelSkipsIntermediateStories() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 0.0, 25.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 3), story(2, 10.0), story(3, 20.0)), column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1), id(3));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 20.0), new VerticalSpan(20.0, 25.0));
        assertThat(pass.levelInfoCache().getLevelInfo(id(2))).isNull();
    }

    @Test
    void split_upToNonStoryLevelFallsBackToDefaultHeight() {
        List<Level> levels = List.of(
                new Level(id(1), "L1", 0.0, true, id(2), 12.0),
                nonStory(2, 4.0),
                story(3, 12.0)
        );
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 0.0, 20.0);
        ExportPass pass = pass(levels, column);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1), id(3));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 12.0), new VerticalSpan(12.0, 20.0));
        assertThat(pass.levelInfoCache().findNextLevel(id(1))).isEqualTo(ElementId.INVALID);
    }

    @Test
    void split_dropsFragmentThatDoesNotAdvance() {
        List<Level> levels = List.of(
                storyWithDefaultHeight(1, 0.0, 20.0),
                storyWithDefaultHeight(2, 10.0, 5.0),
                story(3, 25.0)
        );
        ModelElement wall = element(100, ElementKind.WALL, WALL, 0.0, 30.0);
        ExportPass pass = pass(levels, wall);

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.levels()).containsExactly(id(1), id(3));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 20.0), new VerticalSpan(25.0, 30.0));
        assertOrderedAndDisjoint(result);
    }

    @Test
    void split_clampsStartToPreviousEnd() {
        List<Level> levels = List.of(
                storyWithDefaultHeight(1, 0.0, 12.0),
                storyWithDefaultHeight(2, 10.0, 10.0),
                story(3, 20.0)
        );
        ModelElement wall = element(100, ElementKind.WALL, WALL, 0.0, 28.0);
        ExportPass pass = pass(levels, wall);

        LevelSplitResult result = pass.splitter().split(wall);

        assertThat(result.levels()).containsExactly(id(1), id(2), id(3));
        assertThat(result.ranges()).containsExactly(
                new VerticalSpan(0.0, 12.0),
                new VerticalSpan(12.0, 20.0),
                new VerticalSpan(20.0, 28.0)
        );
    }

    @Test
    void split_registeredHeightIsAuthoritative() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 0.0, 12.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0)), column);
        pass.levelInfoCache().register(id(1), ElementId.INVALID, 5.0);

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1), id(2));
        assertThat(result.ranges()).containsExactly(new VerticalSpan(0.0, 5.0), new VerticalSpan(10.0, 12.0));
    }

    @Test
    void split_warmCacheGivesSameResultAsColdCache() {
        List<Level> levels = List.of(story(1, 0.0, 2), story(2, 10.0, 3), story(3, 20.0), nonStory(4, 15.0));
        ModelElement first = element(100, ElementKind.WALL, WALL, -0.5, 27.0);
        ModelElement second = element(101, ElementKind.FAMILY_INSTANCE, COLUMN, 3.0, 14.0);
        BuildingModel model = TestModels.model(levels, first, second);

        LevelSplitResult cold = ExportPass.begin(model, ExportOptions.defaults(), Map.of()).splitter().split(first);

        ExportPass warmPass = ExportPass.begin(model, ExportOptions.defaults(), Map.of());
        warmPass.splitter().split(second);
        warmPass.splitter().split(first);
        LevelSplitResult warm = warmPass.splitter().split(first);

        assertThat(warm).isEqualTo(cold);
        assertThat(cold.levels()).containsExactly(id(1), id(2), id(3));
        assertOrderedAndDisjoint(cold);
    }

    @Test
    void split_elementBelowAllStoriesGivesNothing() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, -5.0, -1.0);
        ExportPass pass = pass(List.of(story(1, 0.0)), column);

        assertThat(pass.splitter().split(column).isEmpty()).isTrue();
    }

    @Test
    void split_baseLevelThatIsNotAStoryGivesNothing() {
        ModelElement wall = element(100, ElementKind.WALL, WALL, id(2),
                Map.of(LevelParameter.WALL_BASE_CONSTRAINT, id(2)), 0.0, 15.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 3), nonStory(2, 1.0), story(3, 10.0)), wall);

        assertThat(pass.splitter().split(wall).isEmpty()).isTrue();
    }

    @Test
    void split_onlyColumnsWallsAndDuctSegmentsAreSplit() {
        List<Level> levels = List.of(story(1, 0.0, 2), story(2, 10.0));
        ModelElement beam = element(100, ElementKind.FAMILY_INSTANCE, BEAM, 0.0, 15.0);
        ModelElement duct = element(101, ElementKind.MEP_CURVE, DUCT, 0.0, 15.0);
        ExportPass pass = pass(levels, beam, duct);

        assertThat(pass.splitter().split(beam).isEmpty()).isTrue();
        assertThat(pass.splitter().split(duct).levels()).containsExactly(id(1), id(2));
        assertThat(pass.splitter().split(beam, COLUMN).levels()).containsExactly(id(1), id(2));
        assertThat(LevelRangeSplitter.splitsByLevel(new ExportInfoPair(null, null))).isFalse();
    }

    @Test
    void split_missingOrFlatBoundingBoxGivesNothing() {
        ModelElement noBox = new ModelElement(id(100), "E", ElementKind.WALL, WALL, ElementId.INVALID, false,
                null, null, null, Map.of(), Map.of(), null);
        ModelElement flat = element(101, ElementKind.WALL, WALL, 4.0, 4.0);
        ExportPass pass = pass(List.of(story(1, 0.0)), noBox, flat);

        assertThat(pass.splitter().split(noBox).isEmpty()).isTrue();
        assertThat(pass.splitter().split(flat).isEmpty()).isTrue();
    }

    @Test
    void segment_usesGivenExtentInsteadOfBoundingBox() {
        ModelElement wall = element(100, ElementKind.WALL, WALL, 0.0, 1.0);
        ExportPass pass = pass(List.of(story(1, 0.0, 2), story(2, 10.0)), wall);

        LevelSplitResult result = pass.splitter().segment(wall, WALL, new VerticalSpan(4.0, 18.0));

        assertThat(result.fragments()).containsExactly(
                new LevelFragment(id(1), new VerticalSpan(4.0, 10.0)),
                new LevelFragment(id(2), new VerticalSpan(10.0, 18.0))
        );
    }

    @Test
    void segment_customExtensionChangesBoundarySnapping() {
        ModelElement column = element(100, ElementKind.FAMILY_INSTANCE, COLUMN, 0.0, 10.2);
        BuildingModel model = TestModels.model(List.of(story(1, 0.0, 2), story(2, 10.0)), column);
        ExportPass pass = ExportPass.begin(model, new ExportOptions(true, 0.05), Map.of());

        LevelSplitResult result = pass.splitter().split(column);

        assertThat(result.levels()).containsExactly(id(1), id(2));
        assertThat(result.ranges().get(1).start()).isCloseTo(10.0, within(1e-12));
        assertThat(result.ranges().get(1).end()).isCloseTo(10.2, within(1e-12));
    }
}
