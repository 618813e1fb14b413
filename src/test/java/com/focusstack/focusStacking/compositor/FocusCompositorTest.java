package com.focusstack.focusStacking.compositor;

import com.focusstack.TestImages;
import com.focusstack.focusStacking.AlignedFrame;
import com.focusstack.focusStacking.alignment.AlignmentTransform;
import com.focusstack.focusStacking.sharpness.SharpnessMap;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;

class FocusCompositorTest {

    private final FocusCompositor compositor = new FocusCompositor();

    private static AlignedFrame frame(int index, Mat image) {
        return new AlignedFrame(index, image, AlignmentTransform.identity(), true);
    }

    @Test
    void hardModePicksFrameThatIsSharpestInEachRegion() {
        int rows = 4;
        int cols = 6;
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(rows, cols, 10, 10, 10)),
                frame(1, TestImages.solid(rows, cols, 120, 120, 120)),
                frame(2, TestImages.solid(rows, cols, 240, 240, 240)));

        Mat s0 = TestImages.scores(rows, cols, 1.0);
        Mat s1 = TestImages.scores(rows, cols, 0.5);
        Mat s2 = TestImages.scores(rows, cols, 0.1);
        // cột 3..5: frame 2 nét nhất
        for (int y = 0; y < rows; y++) {
            for (int x = 3; x < cols; x++) {
                TestImages.setScore(s2, y, x, 5.0);
            }
        }
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, s0), new SharpnessMap(1, s1), new SharpnessMap(2, s2));

        Mat result = compositor.composite(frames, maps, BlendMode.HARD);

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int expected = x < 3 ? 10 : 240;
                assertThat(TestImages.pixel(result, y, x)).containsExactly(expected, expected, expected);
            }
        }
    }

    @Test
    void hardModeTieGoesToLowestIndex() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(3, 3, 1, 2, 3)),
                frame(1, TestImages.solid(3, 3, 200, 200, 200)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(3, 3, 2.0)),
                new SharpnessMap(1, TestImages.scores(3, 3, 2.0)));

        Mat result = compositor.composite(frames, maps, BlendMode.HARD);

        assertThat(TestImages.identical(result, frames.get(0).getImage())).isTrue();
    }

    @Test
    void hardModeCopiesPixelOfArgmaxFrame() {
        int rows = 12;
        int cols = 15;
        int n = 4;
        Random random = new Random(42);
        List<AlignedFrame> frames = new ArrayList<>();
        List<SharpnessMap> maps = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            frames.add(frame(i, TestImages.noise(rows, cols, 100 + i)));
            Mat s = TestImages.scores(rows, cols, 0);
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    TestImages.setScore(s, y, x, random.nextDouble() * 10);
                }
            }
            maps.add(new SharpnessMap(i, s));
        }

        Mat result = compositor.composite(frames, maps, BlendMode.HARD);

        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int best = 0;
                for (int i = 1; i < n; i++) {
                    if (TestImages.score(maps.get(i).getScores(), y, x)
                            > TestImages.score(maps.get(best).getScores(), y, x)) {
                        best = i;
                    }
                }
                assertThat(TestImages.pixel(result, y, x))
                        .containsExactly(TestImages.pixel(frames.get(best).getImage(), y, x));
            }
        }
    }

    @Test
    void hardModeIgnoresFrameOrderWhenScoresAreDistinct() {
        int rows = 8;
        int cols = 8;
        Random random = new Random(7);
        List<AlignedFrame> frames = new ArrayList<>();
        List<SharpnessMap> maps = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            frames.add(frame(i, TestImages.noise(rows, cols, 200 + i)));
            Mat s = TestImages.scores(rows, cols, 0);
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    TestImages.setScore(s, y, x, random.nextDouble());
                }
            }
            maps.add(new SharpnessMap(i, s));
        }
        Mat forward = compositor.composite(frames, maps, BlendMode.HARD);

        List<AlignedFrame> reversedFrames = new ArrayList<>(frames);
        List<SharpnessMap> reversedMaps = new ArrayList<>(maps);
        Collections.reverse(reversedFrames);
        Collections.reverse(reversedMaps);
        Mat reversed = compositor.composite(reversedFrames, reversedMaps, BlendMode.HARD);

        assertThat(TestImages.identical(forward, reversed)).isTrue();
    }

    @Test
    void featheredModeWeightsBySharpness() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(2, 2, 100, 100, 100)),
                frame(1, TestImages.solid(2, 2, 200, 200, 200)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(2, 2, 1.0)),
                new SharpnessMap(1, TestImages.scores(2, 2, 3.0)));

        Mat result = compositor.composite(frames, maps, BlendMode.FEATHERED);

        // (1*100 + 3*200) / 4 = 175
        assertThat(TestImages.pixel(result, 0, 0)).containsExactly(175, 175, 175);
        assertThat(TestImages.pixel(result, 1, 1)).containsExactly(175, 175, 175);
    }

    @Test
    void featheredModeWithZeroSharpnessEverywhereGivesBlack() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(3, 3, 80, 90, 100)),
                frame(1, TestImages.solid(3, 3, 180, 190, 200)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(3, 3, 0)),
                new SharpnessMap(1, TestImages.scores(3, 3, 0)));

        Mat result = compositor.composite(frames, maps, BlendMode.FEATHERED);

        assertThat(TestImages.pixel(result, 1, 1)).containsExactly(0, 0, 0);
    }

    @Test
    void featheredModeApproachesDominantFrame() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(1, 1, 0, 0, 0)),
                frame(1, TestImages.solid(1, 1, 250, 250, 250)));

        int previous = -1;
        for (double dominance : new double[]{1, 10, 100, 1000, 100000}) {
            List<SharpnessMap> maps = Arrays.asList(
                    new SharpnessMap(0, TestImages.scores(1, 1, 1.0)),
                    new SharpnessMap(1, TestImages.scores(1, 1, dominance)));
            int value = TestImages.pixel(compositor.composite(frames, maps, BlendMode.FEATHERED), 0, 0)[0];
            assertThat(value).isGreaterThanOrEqualTo(previous);
            previous = value;
        }
        assertThat(previous).isGreaterThanOrEqualTo(249);
    }

    @Test
    void saturateClampsAndTruncates() {
        assertThat(FocusCompositor.saturate(-3.2)).isZero();
        assertThat(FocusCompositor.saturate(0.9)).isZero();
        assertThat(FocusCompositor.saturate(127.6)).isEqualTo(127);
        assertThat(FocusCompositor.saturate(254.99)).isEqualTo(254);
        assertThat(FocusCompositor.saturate(255)).isEqualTo(255);
        assertThat(FocusCompositor.saturate(300)).isEqualTo(255);
    }

    @Test
    void featheredFractionIsTruncated() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(1, 1, 100, 100, 100)),
                frame(1, TestImages.solid(1, 1, 200, 200, 200)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(1, 1, 1.0)),
                new SharpnessMap(1, TestImages.scores(1, 1, 2.0)));

        // (100 + 2*200) / 3 = 166.67
        Mat result = compositor.composite(frames, maps, BlendMode.FEATHERED);

        assertThat(TestImages.pixel(result, 0, 0)).containsExactly(166, 166, 166);
    }

    @Test
    void featheredModeIgnoresFrameOrder() {
        int rows = 10;
        int cols = 12;
        Random random = new Random(21);
        List<AlignedFrame> frames = new ArrayList<>();
        List<SharpnessMap> maps = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            frames.add(frame(i, TestImages.noise(rows, cols, 400 + i)));
            Mat s = TestImages.scores(rows, cols, 0);
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    TestImages.setScore(s, y, x, random.nextDouble() * 20);
                }
            }
            maps.add(new SharpnessMap(i, s));
        }
        Mat forward = compositor.composite(frames, maps, BlendMode.FEATHERED);

        List<AlignedFrame> shuffledFrames = Arrays.asList(frames.get(2), frames.get(0), frames.get(1));
        List<SharpnessMap> shuffledMaps = Arrays.asList(maps.get(2), maps.get(0), maps.get(1));
        Mat shuffled = compositor.composite(shuffledFrames, shuffledMaps, BlendMode.FEATHERED);

        // thứ tự cộng khác nhau chỉ lệch ở bit cuối của double
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int[] a = TestImages.pixel(forward, y, x);
                int[] b = TestImages.pixel(shuffled, y, x);
                for (int c = 0; c < 3; c++) {
                    assertThat(Math.abs(a[c] - b[c])).isLessThanOrEqualTo(1);
                }
            }
        }
    }

    @ParameterizedTest
    @EnumSource(BlendMode.class)
    void singleFrameIsReturnedUnchanged(BlendMode mode) {
        Mat image = TestImages.noise(9, 11, 3);
        List<AlignedFrame> frames = Collections.singletonList(frame(0, image));
        List<SharpnessMap> maps = Collections.singletonList(new SharpnessMap(0, TestImages.scores(9, 11, 0)));

        Mat result = compositor.composite(frames, maps, mode);

        assertThat(result).isNotSameAs(image);
        assertThat(TestImages.identical(result, image)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(BlendMode.class)
    void parallelRowsMatchSequentialResult(BlendMode mode) {
        int rows = 40;
        int cols = 30;
        List<AlignedFrame> frames = new ArrayList<>();
        List<SharpnessMap> maps = new ArrayList<>();
        Random random = new Random(99);
        for (int i = 0; i < 3; i++) {
            frames.add(frame(i, TestImages.noise(rows, cols, 300 + i)));
            Mat s = TestImages.scores(rows, cols, 0);
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    TestImages.setScore(s, y, x, random.nextDouble() * 50);
                }
            }
            maps.add(new SharpnessMap(i, s));
        }

        Mat sequential = new FocusCompositor(false).composite(frames, maps, mode);
        Mat parallel = new FocusCompositor(true).composite(frames, maps, mode);

        assertThat(TestImages.identical(sequential, parallel)).isTrue();
    }

    @Test
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> compositor.composite(Collections.emptyList(), Collections.emptyList(), BlendMode.HARD))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsCountMismatch() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(2, 2, 0, 0, 0)),
                frame(1, TestImages.solid(2, 2, 0, 0, 0)));
        List<SharpnessMap> maps = Collections.singletonList(new SharpnessMap(0, TestImages.scores(2, 2, 1)));

        assertThatThrownBy(() -> compositor.composite(frames, maps, BlendMode.FEATHERED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 aligned frames");
    }

    @Test
    void rejectsFrameSizeMismatch() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(2, 2, 0, 0, 0)),
                frame(1, TestImages.solid(3, 2, 0, 0, 0)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(2, 2, 1)),
                new SharpnessMap(1, TestImages.scores(3, 2, 1)));

        assertThatThrownBy(() -> compositor.composite(frames, maps, BlendMode.HARD))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMapSizeMismatch() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, TestImages.solid(2, 2, 0, 0, 0)),
                frame(1, TestImages.solid(2, 2, 0, 0, 0)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(2, 2, 1)),
                new SharpnessMap(1, TestImages.scores(2, 3, 1)));

        assertThatThrownBy(() -> compositor.composite(frames, maps, BlendMode.HARD))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sharpness map 1");
    }

    @Test
    void rejectsNonColorFrames() {
        List<AlignedFrame> frames = Arrays.asList(
                frame(0, new Mat(2, 2, CV_8UC1)),
                frame(1, new Mat(2, 2, CV_8UC1)));
        List<SharpnessMap> maps = Arrays.asList(
                new SharpnessMap(0, TestImages.scores(2, 2, 1)),
                new SharpnessMap(1, TestImages.scores(2, 2, 1)));

        assertThatThrownBy(() -> compositor.composite(frames, maps, BlendMode.HARD))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingBlendMode() {
        List<AlignedFrame> frames = Collections.singletonList(frame(0, TestImages.solid(2, 2, 0, 0, 0)));
        List<SharpnessMap> maps = Collections.singletonList(new SharpnessMap(0, TestImages.scores(2, 2, 1)));

        assertThatThrownBy(() -> compositor.composite(frames, maps, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
