package com.phillippitts.slotwatch.service.probe;

import com.phillippitts.slotwatch.domain.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Classifies page content by case-insensitive substring markers.
 *
 * <p>Precedence is fixed: CAPTCHA markers win over block markers, which win over the
 * "no slots" patterns. Content matching none of them is reported as
 * {@link Status#MAYBE_SLOTS}. An unexpected failure while matching yields {@link Status#OK},
 * which never triggers an alert or a breaker failure.
 */
public class MarkerStatusClassifier implements StatusClassifier {

    private static final Logger LOG = LogManager.getLogger(MarkerStatusClassifier.class);

    private final List<String> captchaMarkers;
    private final List<String> blockMarkers;
    private final List<String> negativePatterns;

    public MarkerStatusClassifier(Collection<String> captchaMarkers,
                                  Collection<String> blockMarkers,
                                  Collection<String> negativePatterns) {
        this.captchaMarkers = normalize(captchaMarkers);
        this.blockMarkers = normalize(blockMarkers);
        this.negativePatterns = normalize(negativePatterns);
    }

    @Override
    public Status classify(String content) {
        try {
            String lower = content.toLowerCase(Locale.ROOT);
            if (containsAny(lower, captchaMarkers)) {
                return Status.CAPTCHA;
            }
            if (containsAny(lower, blockMarkers)) {
                return Status.BLOCKED;
            }
            if (containsAny(lower, negativePatterns)) {
                return Status.NO_SLOTS;
            }
            return Status.MAYBE_SLOTS;
        } catch (RuntimeException e) {
            LOG.error("Status classification failed; reporting OK", e);
            return Status.OK;
        }
    }

    List<String> captchaMarkers() {
        return captchaMarkers;
    }

    List<String> negativePatterns() {
        return negativePatterns;
    }

    /**
     * Splits every entry on {@code ;} or {@code ,}, trims, lower-cases and drops blanks.
     */
    static List<String> normalize(Collection<String> raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split("[;,]")) {
                String marker = part.trim().toLowerCase(Locale.ROOT);
                if (!marker.isEmpty()) {
                    out.add(marker);
                }
            }
        }
        return List.copyOf(out);
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
