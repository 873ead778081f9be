package com.lulcplatform.common.ranking;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link RankingEngine}.
 *
 * <ul>
 *   <li>{@code overall}           – by {@code overallScore}, descending.</li>
 *   <li>{@code perMetric}         – per tracked metric, by raw value in polarity order.</li>
 *   <li>{@code temporalComposite} – overall score with normalized years-available folded in.</li>
 *   <li>{@code temporalCoverage}  – by number of years available, descending.</li>
 * </ul>
 */
public record Rankings(
    @JsonProperty("overall")           List<RankingEntry> overall,
    @JsonProperty("perMetric")         Map<String, List<RankingEntry>> perMetric,
    @JsonProperty("temporalComposite") List<RankingEntry> temporalComposite,
    @JsonProperty("temporalCoverage")  List<RankingEntry> temporalCoverage
) {

    public Rankings {
        overall = List.copyOf(overall);
        perMetric = Collections.unmodifiableMap(new LinkedHashMap<>(perMetric));
        temporalComposite = List.copyOf(temporalComposite);
        temporalCoverage = List.copyOf(temporalCoverage);
    }
}
