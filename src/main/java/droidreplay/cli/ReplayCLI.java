package droidreplay.cli;

import droidreplay.device.OfflineDroid;
import droidreplay.match.SegmentMatch;
import droidreplay.match.SegmentMatcher;
import droidreplay.model.DeviceInfo;
import droidreplay.model.Recording;
import droidreplay.model.RecordingIO;
import droidreplay.model.Ui;
import droidreplay.player.PlayerConfig;
import droidreplay.player.PlayerEngine;
import droidreplay.segment.Segment;
import droidreplay.segment.SegmentationResult;
import droidreplay.segment.Segmenter;
import droidreplay.segment.Segments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point of droid-replay.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code droid-replay segment}   print the segments of a UI dump</li>
 *   <li>{@code droid-replay match}     pair the segments of two UI dumps</li>
 *   <li>{@code droid-replay translate} dry-run a recording against a playee UI dump</li>
 *   <li>{@code droid-replay version}   print build version</li>
 * </ul>
 */
@Command(
        name        = "droid-replay",
        description = "Replays Android UI recordings across devices of different screen sizes",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                ReplayCLI.SegmentCommand.class,
                ReplayCLI.MatchCommand.class,
                ReplayCLI.TranslateCommand.class,
                ReplayCLI.VersionCommand.class
        }
)
public class ReplayCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ReplayCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Segments a UI dump and prints the accepted segments.
     */
    @Command(
            name        = "segment",
            description = "Segment a UI dump and print the accepted segments",
            mixinStandardHelpOptions = true
    )
    static class SegmentCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to UI dump JSON file")
        Path uiFile;

        @Option(names = {"-d", "--device"}, required = true,
                description = "Path to device JSON file the dump was taken on")
        Path deviceFile;

        @Override
        public Integer call() throws Exception {
            if (!exists(uiFile) || !exists(deviceFile)) {
                return 1;
            }
            Ui ui = RecordingIO.readUi(uiFile);
            DeviceInfo device = RecordingIO.readDevice(deviceFile);
            SegmentationResult result = new PlayerConfig().createSegmenter().segment(ui, device);

            System.out.printf("Segments of %s on %s: %d%n", uiFile.getFileName(), device, result.accepted().size());
            int i = 0;
            for (Segment s : result.accepted()) {
                System.out.printf("  [%2d] %s level=%d roots=%s%n", i++, Segments.xxyy(s), s.getLevel(), s.getRoots());
            }
            return 0;
        }
    }

    /**
     * Segments two UI dumps and prints the optimal pairing of their segments.
     */
    @Command(
            name        = "match",
            description = "Match the segments of two UI dumps",
            mixinStandardHelpOptions = true
    )
    static class MatchCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Recordee UI dump JSON file")
        Path recordeeUi;

        @Parameters(index = "1", description = "Playee UI dump JSON file")
        Path playeeUi;

        @Option(names = {"--recordee-device"}, required = true, description = "Recordee device JSON file")
        Path recordeeDevice;

        @Option(names = {"--playee-device"}, required = true, description = "Playee device JSON file")
        Path playeeDevice;

        @Override
        public Integer call() throws Exception {
            if (!exists(recordeeUi) || !exists(playeeUi) || !exists(recordeeDevice) || !exists(playeeDevice)) {
                return 1;
            }
            Segmenter segmenter = new PlayerConfig().createSegmenter();
            List<Segment> rSegs = segmenter.segment(RecordingIO.readUi(recordeeUi),
                    RecordingIO.readDevice(recordeeDevice)).accepted();
            List<Segment> pSegs = segmenter.segment(RecordingIO.readUi(playeeUi),
                    RecordingIO.readDevice(playeeDevice)).accepted();

            SegmentMatch match = new SegmentMatcher().match(rSegs, pSegs);
            System.out.printf("Recordee segments: %d, playee segments: %d%n", rSegs.size(), pSegs.size());
            for (int a = 0; a < match.size(); a++) {
                int b = match.getPair(a);
                Segment left  = match.getLeft().get(a);
                Segment right = match.getRight().get(b);
                System.out.printf("  %-28s <-> %-28s score=%d%n", label(left), label(right), match.getScore(a, b));
            }
            return 0;
        }

        private static String label(Segment s) {
            return s == SegmentMatch.NO_MATCH ? "(none)" : Segments.xxyy(s);
        }
    }

    /**
     * Replays a recording against a static playee UI dump and prints the
     * actions that would be sent to the device.
     */
    @Command(
            name        = "translate",
            description = "Dry-run a recording against a playee UI dump and print the translated actions",
            mixinStandardHelpOptions = true
    )
    static class TranslateCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

        @Parameters(index = "0", description = "Path to recording JSON file")
        Path recordingFile;

        @Option(names = {"--playee-ui"}, required = true, description = "Playee UI dump JSON file")
        Path playeeUi;

        @Option(names = {"--playee-device"}, required = true, description = "Playee device JSON file")
        Path playeeDevice;

        @Override
        public Integer call() throws Exception {
            if (!exists(recordingFile) || !exists(playeeUi) || !exists(playeeDevice)) {
                return 1;
            }
            Recording recording = RecordingIO.read(recordingFile);
            System.out.printf("  App       : %s%n", recording.getApp());
            System.out.printf("  Events    : %d%n", recording.getEventCount());
            System.out.printf("  Recordee  : %s%n", recording.getDevice());

            OfflineDroid droid = new OfflineDroid(RecordingIO.readDevice(playeeDevice), RecordingIO.readUi(playeeUi));
            System.out.printf("  Playee    : %s%n", droid.getDeviceInfo());

            PlayerEngine.PlaybackResult result = new PlayerEngine(droid).play(recording);
            log.debug("Dry run finished with {} actions", droid.getActions().size());

            System.out.println();
            System.out.println("Actions:");
            droid.getActions().forEach(a -> System.out.println("  " + a));
            System.out.println();
            System.out.println("Events:");
            result.getOutcomes().forEach(o -> System.out.println("  " + o));
            System.out.printf("%n%s%n", result);

            if (!result.isSuccess()) {
                System.err.println("Translation FAILED: " + result.getFailureReason());
                return 2;
            }
            return 0;
        }
    }

    @Command(
            name        = "version",
            description = "Print version information",
            mixinStandardHelpOptions = true
    )
    static class VersionCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            System.out.println("droid-replay 1.0.0-SNAPSHOT");
            System.out.println("Modules: geometry, matching, text, model, device, segment, match, select,");
            System.out.println("         pattern, player, cli");
            return 0;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static boolean exists(Path file) {
        if (!Files.exists(file)) {
            System.err.println("File not found: " + file.toAbsolutePath());
            return false;
        }
        return true;
    }
}
