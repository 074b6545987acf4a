package ch.so.arp.assistant.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outputs realised by the steps of a single plan execution, keyed by
 * {@code step_<N>_output}. Entries are only ever added.
 */
public final class StepOutputs {

    private final Map<String, String> outputs = new LinkedHashMap<>();

    public static String key(int position) {
        return "step_" + position + "_output";
    }

    void record(int position, String output) {
        String key = key(position);
        if (outputs.containsKey(key)) {
            throw new IllegalStateException("Output of step " + position + " already recorded");
        }
        outputs.put(key, Objects.requireNonNull(output, "output"));
    }

    public Optional<String> get(int position) {
        return Optional.ofNullable(outputs.get(key(position)));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(outputs);
    }

    public int size() {
        return outputs.size();
    }
}
