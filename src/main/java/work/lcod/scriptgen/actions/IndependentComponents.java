package work.lcod.scriptgen.actions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.BuilderArgs;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

/**
 * ICA in three steps: fit the decomposition, classify components automatically, then let the user confirm the
 * exclusions. Detection helpers are imported from the pipeline runtime by the generated code.
 */
public final class IndependentComponents implements TemplateProvider {
    private static final Template FIT_ALL_EEG = Template.extract("""
        def _fit_all_eeg(raw, method='infomax', fit_params=None):
            ica = mne.preprocessing.ICA(
                n_components=len(mne.pick_types(raw.info, eeg=True)),
                method=method,
                random_state=42,
                fit_params=fit_params,
            )
            ica.fit(raw)
        """);
    private static final Template FIT_FIXED = Template.extract("""
        def _fit_fixed(raw, n_components=20, method='infomax', fit_params=None):
            ica = mne.preprocessing.ICA(
                n_components=n_components,
                method=method,
                random_state=42,
                fit_params=fit_params,
            )
            ica.fit(raw)
        """);
    private static final Template CLASSIFY = Template.extract("""
        def _classify(raw, enable_iclabel=True, iclabel_threshold=0.5, enable_eog=True, eog_threshold=3.0,
                      enable_ecg=True, ecg_threshold=0.25, enable_muscle=True, muscle_threshold=0.9):
            from pipeline_runtime.ica import channel_meta, iclabel_exclusions, run_detector

            exclude = []
            eog_indices, eog_scores = [], None
            ecg_indices, ecg_scores = [], None
            muscle_indices, muscle_scores = [], None
            has_eog_channel, eog_channel_names = channel_meta(raw, 'eog')
            has_ecg_channel, ecg_channel_names = channel_meta(raw, 'ecg')

            if enable_iclabel:
                exclude = iclabel_exclusions(raw, ica, threshold=iclabel_threshold)

            if enable_eog:
                eog_indices, eog_scores = run_detector('EOG', ica.find_bads_eog, raw, threshold=eog_threshold, verbose=False)

            if enable_ecg:
                ecg_indices, ecg_scores = run_detector(
                    'ECG', ica.find_bads_ecg, raw, method='correlation', threshold=ecg_threshold, verbose=False
                )

            if enable_muscle:
                muscle_indices, muscle_scores = run_detector(
                    'Muscle', ica.find_bads_muscle, raw, threshold=muscle_threshold, verbose=False
                )

            ica.exclude = sorted(set(exclude) | set(eog_indices) | set(ecg_indices) | set(muscle_indices))
            detection_details = {
                'eog_scores': eog_scores,
                'ecg_scores': ecg_scores,
                'muscle_scores': muscle_scores,
                'eog_indices': eog_indices,
                'ecg_indices': ecg_indices,
                'muscle_indices': muscle_indices,
                'has_eog_channel': has_eog_channel,
                'has_ecg_channel': has_ecg_channel,
                'eog_channel_names': eog_channel_names,
                'ecg_channel_names': ecg_channel_names,
                'enable_iclabel': enable_iclabel,
                'enable_eog': enable_eog,
                'enable_ecg': enable_ecg,
                'enable_muscle': enable_muscle,
            }
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("ica")
            .title("ICA")
            .doc("ICA with automatic ICLabel classification. Fit, classify components, then manually select which to remove.")
            .docUrl("https://mne.tools/stable/generated/mne.preprocessing.ICA.html")
            .docUrl("https://mne.tools/mne-icalabel/dev/index.html")
            .prerequisite("notch", "Removing line noise prevents components being wasted on it.")
            .prerequisite("reference", "A common average improves ICA decomposition quality.")
            .from(new IndependentComponents());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(fitStep(), classifyStep(), inspectStep());
    }

    private static StepBuilder fitStep() {
        return StepBuilder.step("fit")
            .title("Fit ICA")
            .param("n_components", Integer.class, 0, ParamSpec.builder("int")
                .label("Components (0 = all channels)")
                .description("Number of ICA components. 0 means use number of EEG channels.")
                .defaultValue(0)
                .min(0)
                .max(999))
            .param("method", String.class, "infomax", ParamSpec.builder("choice")
                .label("Method")
                .description("ICA algorithm to use. Infomax (extended) recommended for ICLabel.")
                .defaultValue("infomax")
                .choices("fastica", "infomax", "picard"))
            .build(IndependentComponents::renderFit);
    }

    private static StepBuilder classifyStep() {
        return StepBuilder.step("classify")
            .title("Classify Components")
            .param("enable_iclabel", Boolean.class, true, ParamSpec.builder("bool")
                .label("Enable ICLabel")
                .description("Use ICLabel neural network to classify components (brain, eye, heart, muscle, etc.).")
                .defaultValue(true))
            .param("iclabel_threshold", Double.class, 0.5, ParamSpec.builder("float")
                .label("ICLabel threshold")
                .description("Probability threshold for ICLabel exclusion. Components classified as non-brain above "
                    + "this threshold are excluded.")
                .defaultValue(0.5)
                .min(0.0)
                .max(1.0))
            .param("enable_eog", Boolean.class, true, ParamSpec.builder("bool")
                .label("Enable EOG detection")
                .description("Detect ocular components via EOG channel correlation.")
                .defaultValue(true))
            .param("eog_threshold", Double.class, 3.0, ParamSpec.builder("float")
                .label("EOG threshold")
                .description("Z-score threshold for EOG correlation detection.")
                .defaultValue(3.0)
                .min(0.5)
                .max(10.0))
            .param("enable_ecg", Boolean.class, true, ParamSpec.builder("bool")
                .label("Enable ECG detection")
                .description("Detect cardiac components via ECG channel correlation.")
                .defaultValue(true))
            .param("ecg_threshold", Double.class, 0.25, ParamSpec.builder("float")
                .label("ECG threshold")
                .description("Correlation threshold for ECG detection (method='correlation').")
                .defaultValue(0.25)
                .min(0.01)
                .max(1.0))
            .param("enable_muscle", Boolean.class, true, ParamSpec.builder("bool")
                .label("Enable muscle detection")
                .description("Detect muscle artifact components via high-frequency power.")
                .defaultValue(true))
            .param("muscle_threshold", Double.class, 0.9, ParamSpec.builder("float")
                .label("Muscle threshold")
                .description("Z-score threshold for muscle artifact detection.")
                .defaultValue(0.9)
                .min(0.1)
                .max(5.0))
            .build(args -> CLASSIFY.inline(args.values()));
    }

    private static StepBuilder inspectStep() {
        return StepBuilder.step("inspect")
            .title("Manual Selection")
            .interactive()
            .build(args -> "raw = ica.apply(raw, verbose=False)");
    }

    /** Extended infomax is requested whenever infomax is used; 0 components means one per EEG channel. */
    static String renderFit(BuilderArgs args) {
        String method = args.asString("method");
        var values = new LinkedHashMap<String, Object>();
        values.put("method", method);
        values.put("fit_params", "infomax".equals(method) ? Map.of("extended", true) : null);
        long components = args.asLong("n_components");
        if (components == 0) {
            return FIT_ALL_EEG.inline(values);
        }
        values.put("n_components", components);
        return FIT_FIXED.inline(values);
    }
}
