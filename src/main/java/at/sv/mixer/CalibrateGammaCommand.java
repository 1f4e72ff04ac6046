package at.sv.mixer;

import at.sv.mixer.color.ColorDifference;
import at.sv.mixer.color.ColorTriple;
import at.sv.mixer.mixing.CalibrationSample;
import at.sv.mixer.mixing.GammaCalibrator;
import at.sv.mixer.mixing.PigmentMixer;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

@Command(name = "calibrate", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Finds the gamma of the Kubelka-Munk model that best reproduces observed white and black gradations.")
public final class CalibrateGammaCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--min-gamma", defaultValue = "" + GammaCalibrator.DEFAULT_MIN_GAMMA,
            description = "The lowest gamma to try. Default: ${DEFAULT-VALUE}")
    double minGamma;
    @Option(names = "--max-gamma", defaultValue = "" + GammaCalibrator.DEFAULT_MAX_GAMMA,
            description = "The highest gamma to try. Default: ${DEFAULT-VALUE}")
    double maxGamma;
    @Option(names = "--steps", defaultValue = "" + GammaCalibrator.DEFAULT_STEPS,
            description = "The number of evenly spaced gamma values to try. Default: ${DEFAULT-VALUE}")
    int steps;

    @Override
    public void run() {
        MDC.put("context", "calibrate");
        List<CalibrationSample> samples = GammaCalibrator.whiteBlackGradations();
        GammaCalibrator.Result result = new GammaCalibrator(minGamma, maxGamma, steps).calibrate(samples);

        PrintWriter out = spec.commandLine().getOut();
        PigmentMixer mixer = new PigmentMixer(result.gamma());
        for (CalibrationSample sample : samples) {
            ColorTriple predicted = mixer.mixKubelkaMunk(sample.colors(), sample.ratios());
            out.println(String.format(Locale.ROOT, "%-24s expected L=%5.1f predicted L=%5.1f (DE76 %s)",
                    sample.name(), sample.expected().L(), predicted.L(),
                    FormatUtil.formatDeltaE(ColorDifference.deltaE76(sample.expected(), predicted))));
        }
        out.println(String.format(Locale.ROOT, "Best gamma: %.2f (mean DE76 %s)", result.gamma(),
                FormatUtil.formatDeltaE(result.meanError())));
        out.flush();
    }
}
