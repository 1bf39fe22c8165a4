package com.npssenti.crawler.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Quality {

    private double score;

    /** Every contributing or penalising factor, in evaluation order */
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    private int length;

    @JsonProperty("keyword_hits")
    private int keywordHits;

    @JsonProperty("keyword_coverage")
    private double keywordCoverage;

    @JsonProperty("lang_confidence")
    private double langConfidence;
}
