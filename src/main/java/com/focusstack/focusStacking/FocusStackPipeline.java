package com.focusstack.focusStacking;

import com.focusstack.focusStacking.alignment.AlignmentEngine;
import com.focusstack.focusStacking.alignment.AlignmentResult;
import com.focusstack.focusStacking.alignment.AlignmentTransform;
import com.focusstack.focusStacking.compositor.FocusCompositor;
import com.focusstack.focusStacking.sharpness.SharpnessMap;
import com.focusstack.focusStacking.sharpness.SharpnessMapper;
import com.focusstack.imageIO.ImageSink;
import com.focusstack.imageIO.ImageSource;
import com.focusstack.imageIO.OpenCvImageSink;
import com.focusstack.imageIO.OpenCvImageSource;
import com.focusstack.imageIO.OutputFormat;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import static org.bytedeco.opencv.global.opencv_imgproc.INTER_AREA;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * Điều phối một lần focus stacking: load → align → sharpness → composite → save.
 *
 * <pre>
 * EMPTY → LOADED → ALIGNED → SHARPNESS_COMPUTED → COMPOSITED → SAVED
 *   (bất kỳ bước nào lỗi nghiêm trọng) → FAILED
 * </pre>
 *
 * <p>Mỗi instance chỉ dùng cho một lần chạy và một luồng gọi. Căn chỉnh và tính độ nét
 * từng frame có thể chạy song song trên thread pool riêng của lần chạy đó. Sau SAVED hoặc
 * FAILED, bộ nhớ native của stack đã được giải phóng.</p>
 */
public class FocusStackPipeline {
    private static final Logger logger = LoggerFactory.getLogger(FocusStackPipeline.class);
    private static final long WORKER_SHUTDOWN_SECONDS = 30;

    @Getter
    private final StackOptions options;
    private final ImageSource source;
    private final ImageSink sink;
    private final AlignmentEngine alignmentEngine;
    private final SharpnessMapper sharpnessMapper;
    private final FocusCompositor compositor;

    @Getter
    private StackState state = StackState.EMPTY;
    @Getter
    private final FocusStack stack;
    // số frame đã load được, vẫn giữ sau khi stack được giải phóng
    @Getter
    private int frameCount;

    public FocusStackPipeline(StackOptions options) {
        this(options, new OpenCvImageSource(), new OpenCvImageSink());
    }

    public FocusStackPipeline(StackOptions options, ImageSource source, ImageSink sink) {
        this(options, source, sink, new AlignmentEngine(), new SharpnessMapper(),
                new FocusCompositor(options.isParallel()));
    }

    public FocusStackPipeline(StackOptions options, ImageSource source, ImageSink sink,
                              AlignmentEngine alignmentEngine, SharpnessMapper sharpnessMapper,
                              FocusCompositor compositor) {
        this.options = options.validate();
        this.source = source;
        this.sink = sink;
        this.alignmentEngine = alignmentEngine;
        this.sharpnessMapper = sharpnessMapper;
        this.compositor = compositor;
        this.stack = new FocusStack(options.getBlendMode());
    }

    /**
     * Chạy toàn bộ pipeline và trả về đường dẫn ảnh đã ghi.
     */
    public Path process(List<Path> imagePaths, Path outputPath) {
        load(imagePaths);
        align();
        computeSharpnessMaps();
        composite();
        Path written = save(outputPath);
        logger.info("Focus stacking complete!");
        return written;
    }

    public void load(List<Path> imagePaths) {
        requireState(StackState.EMPTY, "load");
        logger.info("Loading images...");
        try {
            for (Path path : imagePaths) {
                Optional<Mat> decoded = source.read(path);
                if (decoded.isEmpty()) {
                    logger.warn("Could not read image {}, skipping.", path);
                    continue;
                }
                Mat img = downscale(decoded.get());
                stack.addFrame(new Frame(stack.size(), path.toString(), img));
            }
        } catch (RuntimeException e) {
            throw fail(StackState.LOADED, "Error while loading images: " + e.getMessage(), e);
        }
        if (stack.size() == 0) {
            throw fail(StackState.LOADED, "No valid images could be loaded", null);
        }
        frameCount = stack.size();
        state = StackState.LOADED;
        logger.info("Loaded {} images", frameCount);
    }

    private Mat downscale(Mat img) {
        double factor = options.getDownscaleFactor();
        if (factor == 1.0) return img;

        int width = Math.max(1, (int) (img.cols() * factor));
        int height = Math.max(1, (int) (img.rows() * factor));
        Mat resized = new Mat();
        resize(img, resized, new Size(width, height), 0, 0, INTER_AREA);
        img.release();
        return resized;
    }

    /**
     * Căn chỉnh mọi frame về frame đầu tiên. Frame căn chỉnh lỗi vẫn được giữ (pixel gốc).
     */
    public void align() {
        requireState(StackState.LOADED, "align");
        List<Frame> frames = stack.getFrames();
        logger.info("Aligning images using {} method...", options.getAlignmentMethod().value());

        try {
            stack.allocateAlignedSlots();
            Frame reference = frames.get(0);
            stack.putAligned(0, new AlignedFrame(0, reference.getImage(), AlignmentTransform.identity(), true));

            // 1 ảnh: bỏ qua căn chỉnh
            if (frames.size() > 1) {
                AtomicInteger failures = new AtomicInteger();
                runPerFrame(StackState.ALIGNED, frames.size() - 1, k -> {
                    Frame frame = frames.get(k + 1);
                    AlignmentResult res = alignmentEngine.align(reference.getImage(), frame.getImage(),
                            options.getAlignmentMethod());
                    if (!res.isSucceeded()) {
                        failures.incrementAndGet();
                        logger.debug("Alignment failed for image {} ({}): {}", frame.getIndex(),
                                frame.getSource(), res.getFailureReason());
                    }
                    stack.putAligned(frame.getIndex(), new AlignedFrame(frame.getIndex(), res.getImage(),
                            res.getTransform(), res.isSucceeded()));
                });
                if (failures.get() > 0) {
                    logger.warn("{} of {} images could not be aligned and are used unregistered",
                            failures.get(), frames.size() - 1);
                }
            }
            checkAlignedDimensions(reference);
        } catch (FocusStackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw fail(StackState.ALIGNED, "Error while aligning images: " + e.getMessage(), e);
        }
        state = StackState.ALIGNED;
        logger.info("Aligned {} images", frames.size());
    }

    private void checkAlignedDimensions(Frame reference) {
        for (AlignedFrame aligned : stack.getAlignedFrames()) {
            if (aligned.width() != reference.width() || aligned.height() != reference.height()) {
                throw fail(StackState.ALIGNED, String.format("Image %d is %dx%d but the reference is %dx%d; stacks with differing"
                                + " resolutions are not supported", aligned.getIndex(), aligned.width(),
                        aligned.height(), reference.width(), reference.height()), null);
            }
        }
    }

    public void computeSharpnessMaps() {
        requireState(StackState.ALIGNED, "computeSharpnessMaps");
        logger.info("Computing sharpness maps using {} metric...", options.getSharpnessMetric().value());

        try {
            List<AlignedFrame> aligned = stack.getAlignedFrames();
            stack.allocateSharpnessSlots();
            runPerFrame(StackState.SHARPNESS_COMPUTED, aligned.size(), i -> stack.putSharpness(i, sharpnessMapper.computeMap(aligned.get(i),
                    options.getSharpnessMetric(), options.getKernelSize())));
        } catch (FocusStackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw fail(StackState.SHARPNESS_COMPUTED, "Error while computing sharpness maps: " + e.getMessage(), e);
        }
        state = StackState.SHARPNESS_COMPUTED;
        logger.info("Computed {} sharpness maps", stack.size());

        if (options.getDebugDir() != null) {
            writeDebugHeatmaps(options.getDebugDir());
        }
    }

    private void writeDebugHeatmaps(Path debugDir) {
        for (SharpnessMap map : stack.getSharpnessMaps()) {
            Path target = debugDir.resolve(String.format("sharpness_map_%02d.png", map.getFrameIndex()));
            Mat heatmap = map.toHeatmap();
            try {
                sink.write(heatmap, target, OutputFormat.PNG);
            } catch (IOException e) {
                logger.warn("Could not write sharpness heat map {}: {}", target, e.getMessage());
            } finally {
                heatmap.release();
            }
        }
    }

    public void composite() {
        requireState(StackState.SHARPNESS_COMPUTED, "composite");
        logger.info("Generating focus stack...");

        try {
            Mat result = compositor.composite(stack.getAlignedFrames(), stack.getSharpnessMaps(), stack.getBlendMode());
            stack.setComposite(result);
        } catch (RuntimeException e) {
            throw fail(StackState.COMPOSITED, "Compositing failed: " + e.getMessage(), e);
        }
        state = StackState.COMPOSITED;
        logger.info("Focus stack generated");
    }

    /**
     * Ghi ảnh kết quả qua ImageSink rồi giải phóng dữ liệu của lần chạy.
     */
    public Path save(Path outputPath) {
        requireState(StackState.COMPOSITED, "save");
        Mat result = stack.getComposite();
        if (result == null || result.empty()) {
            throw fail(StackState.SAVED, "No output image has been generated", null);
        }

        Path written;
        try {
            written = sink.write(result, outputPath, options.getOutputFormat());
        } catch (IOException | RuntimeException e) {
            throw fail(StackState.SAVED, "Could not save output to " + outputPath + ": " + e.getMessage(), e);
        }
        state = StackState.SAVED;
        stack.discard();
        return written;
    }

    private void requireState(StackState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " while pipeline is " + state
                    + " (expected " + expected + ")");
        }
    }

    private FocusStackException fail(StackState stage, String message, Throwable cause) {
        state = StackState.FAILED;
        logger.error("Focus stacking failed during {}: {}", stage, message);
        stack.discard();
        return new FocusStackException(message, stage, cause);
    }

    /**
     * Chạy task(0..count-1). Mỗi task chỉ ghi vào slot của chính nó.
     */
    private void runPerFrame(StackState stage, int count, IntConsumer task) {
        if (!options.isParallel() || count < 2) {
            for (int i = 0; i < count; i++) task.accept(i);
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(options.effectiveWorkers(count));
        InterruptedException interrupted = null;
        Throwable failure = null;
        try {
            List<Future<?>> futures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                final int idx = i;
                futures.add(executor.submit(() -> task.accept(idx)));
            }
            for (Future<?> f : futures) f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = e;
        } catch (ExecutionException e) {
            failure = e.getCause();
        } finally {
            executor.shutdownNow();
            awaitWorkers(executor);
        }

        // worker đã dừng hẳn thì mới được giải phóng stack
        if (interrupted != null) throw fail(stage, "Interrupted while processing frames", interrupted);
        if (failure instanceof RuntimeException) throw (RuntimeException) failure;
        if (failure != null) throw fail(stage, "Worker failed: " + failure, failure);
    }

    private void awaitWorkers(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(WORKER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Frame workers did not stop within {}s", WORKER_SHUTDOWN_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for frame workers to stop");
        }
    }
}
