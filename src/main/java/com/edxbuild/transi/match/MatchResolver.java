package com.edxbuild.transi.match;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edxbuild.transi.catalog.NarrCatalog;
import com.edxbuild.transi.error.AmbiguousMatchException;
import com.edxbuild.transi.model.ManualMapEntry;
import com.edxbuild.transi.model.MatchClass;
import com.edxbuild.transi.model.MatchResolution;
import com.edxbuild.transi.model.NarrEntry;
import com.edxbuild.transi.model.RawStep;

/**
 * Decides which narration entry, if any, applies to a raw step.
 *
 * Resolution is exact-key lookup of the step's manual-map token, tried in order:
 * <ol>
 *   <li>the token as a narration code;</li>
 *   <li>the token as a full {@code OPM_Step} value, which must name a single entry;</li>
 *   <li>the token's leading code ({@code "M7: Press start"} gives {@code M7}) as a narration code.</li>
 * </ol>
 * A step without a manual-map entry, or whose token resolves to nothing, gets {@link MatchClass#NONE}.
 */
public class MatchResolver {

    private static final Logger log = LoggerFactory.getLogger(MatchResolver.class);

    static final Pattern LEAD_CODE = Pattern.compile("^\\s*([A-Za-z]\\d+[a-z]?)\\b");

    private final NarrCatalog catalog;
    private final String mClassPrefix;

    /**
     * @param mClassPrefix code prefix marking M-class entries, compared ignoring case
     */
    public MatchResolver(NarrCatalog catalog, String mClassPrefix) {
        this.catalog = catalog;
        this.mClassPrefix = mClassPrefix == null ? "" : mClassPrefix.trim();
    }

    /**
     * @throws AmbiguousMatchException when the token is an {@code OPM_Step} shared by several entries
     */
    public MatchResolution resolve(RawStep step, Optional<ManualMapEntry> manualEntry) {
        if (manualEntry.isEmpty()) {
            return MatchResolution.none();
        }
        String token = manualEntry.get().getMatchToken().trim();
        Optional<NarrEntry> entry = lookup(step.getCode(), token);
        if (entry.isEmpty()) {
            log.warn("Manual match '{}' for raw step {} names no narration entry", token, step.getCode());
            return MatchResolution.none();
        }
        MatchClass matchClass = isMClass(entry.get()) ? MatchClass.M : MatchClass.NON_M;
        log.debug("Raw step {} -> {} ({})", step.getCode(), entry.get().getCode(), matchClass);
        return MatchResolution.of(entry.get(), matchClass);
    }

    public boolean isMClass(NarrEntry entry) {
        String code = entry.getCode();
        return !mClassPrefix.isEmpty()
                && code.regionMatches(true, 0, mClassPrefix, 0, mClassPrefix.length());
    }

    private Optional<NarrEntry> lookup(String rawCode, String token) {
        if (token.isEmpty()) {
            return Optional.empty();
        }
        Optional<NarrEntry> byCode = catalog.findByCode(token);
        if (byCode.isPresent()) {
            return byCode;
        }
        List<NarrEntry> byStep = catalog.findByOpmStep(token);
        if (byStep.size() > 1) {
            throw new AmbiguousMatchException(rawCode, token,
                    byStep.stream().map(NarrEntry::getCode).collect(Collectors.toList()));
        }
        if (byStep.size() == 1) {
            return Optional.of(byStep.get(0));
        }
        return leadCode(token).flatMap(catalog::findByCode);
    }

    /**
     * Leading code token of {@code text}, upper-cased ({@code "p3b - Check"} gives {@code P3B}).
     */
    public static Optional<String> leadCode(String text) {
        Matcher matcher = LEAD_CODE.matcher(text == null ? "" : text);
        return matcher.find()
                ? Optional.of(matcher.group(1).toUpperCase(Locale.ROOT))
                : Optional.empty();
    }
}
