/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ets.search;

import static com.amazon.ets.CommonUtils.checkArgument;
import static com.amazon.ets.CommonUtils.checkNotNull;
import static com.amazon.ets.CommonUtils.hasNonPositive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.ets.config.DampedPolicy;
import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;
import com.amazon.ets.model.SmoothingConfig;

import lombok.Getter;

/**
 * Parses a model specification such as "ZZZ", "AAdN" or "MNM" and enumerates
 * the candidate structures it admits. Each position is error, trend and
 * season; the letter Z lets the search choose. An optional fourth letter at
 * the third position sets damping: d for always, N for never, Z for automatic.
 */
public class CandidateSearchSpace {

    @Getter
    private final int seasonLength;
    @Getter
    private final String spec;

    private final List<ErrorType> errorOptions;
    private final List<TrendType> trendOptions;
    private final List<SeasonType> seasonOptions;
    private final boolean multiplicativeTrendRequested;

    @Getter
    private DampedPolicy dampedPolicy;
    @Getter
    private boolean allowMultiplicativeTrend;

    public CandidateSearchSpace(int seasonLength, String spec) {
        checkArgument(seasonLength > 0, "season length must be positive");
        checkNotNull(spec, "spec cannot be null");
        checkArgument(spec.length() == 3 || spec.length() == 4, "spec must have three or four letters");
        this.seasonLength = seasonLength;
        this.spec = spec;

        char errorCode = Character.toUpperCase(spec.charAt(0));
        char trendCode = Character.toUpperCase(spec.charAt(1));
        char seasonCode;
        if (spec.length() == 4) {
            char dampedCode = spec.charAt(2);
            if (dampedCode == 'd' || dampedCode == 'D') {
                dampedPolicy = DampedPolicy.ALWAYS;
            } else if (dampedCode == 'N' || dampedCode == 'n') {
                dampedPolicy = DampedPolicy.NEVER;
            } else {
                checkArgument(dampedCode == 'Z' || dampedCode == 'z', "damping letter must be d, N or Z");
                dampedPolicy = DampedPolicy.AUTO;
            }
            seasonCode = Character.toUpperCase(spec.charAt(3));
        } else {
            dampedPolicy = DampedPolicy.AUTO;
            seasonCode = Character.toUpperCase(spec.charAt(2));
        }

        checkArgument(errorCode != 'N', "error component cannot be N");
        checkArgument(!(errorCode == 'A' && (trendCode == 'M' || seasonCode == 'M')),
                "additive error cannot be combined with a multiplicative component");
        checkArgument(!(errorCode == 'M' && trendCode == 'M' && seasonCode == 'M'),
                "the fully multiplicative model is not supported");

        errorOptions = errorOptions(errorCode);
        trendOptions = trendOptions(trendCode);
        seasonOptions = seasonOptions(seasonCode, seasonLength);
        multiplicativeTrendRequested = trendCode == 'M';
        if (dampedPolicy == DampedPolicy.ALWAYS) {
            checkArgument(hasTrendOption(), "damping requires a trend");
        }
    }

    public CandidateSearchSpace(int seasonLength) {
        this(seasonLength, "ZZZ");
    }

    private static List<ErrorType> errorOptions(char code) {
        switch (code) {
        case 'A':
            return Collections.singletonList(ErrorType.ADDITIVE);
        case 'M':
            return Collections.singletonList(ErrorType.MULTIPLICATIVE);
        case 'Z':
            return List.of(ErrorType.ADDITIVE, ErrorType.MULTIPLICATIVE);
        default:
            throw new IllegalArgumentException("unknown error letter " + code);
        }
    }

    private static List<TrendType> trendOptions(char code) {
        switch (code) {
        case 'N':
            return Collections.singletonList(TrendType.NONE);
        case 'A':
            return Collections.singletonList(TrendType.ADDITIVE);
        case 'M':
            return Collections.singletonList(TrendType.MULTIPLICATIVE);
        case 'Z':
            return List.of(TrendType.NONE, TrendType.ADDITIVE, TrendType.MULTIPLICATIVE);
        default:
            throw new IllegalArgumentException("unknown trend letter " + code);
        }
    }

    private static List<SeasonType> seasonOptions(char code, int seasonLength) {
        switch (code) {
        case 'N':
            return Collections.singletonList(SeasonType.NONE);
        case 'A':
            checkArgument(seasonLength >= 2, "a seasonal model needs a season length of at least 2");
            return Collections.singletonList(SeasonType.ADDITIVE);
        case 'M':
            checkArgument(seasonLength >= 2, "a seasonal model needs a season length of at least 2");
            return Collections.singletonList(SeasonType.MULTIPLICATIVE);
        case 'Z':
            if (seasonLength < 2) {
                return Collections.singletonList(SeasonType.NONE);
            }
            return List.of(SeasonType.NONE, SeasonType.ADDITIVE, SeasonType.MULTIPLICATIVE);
        default:
            throw new IllegalArgumentException("unknown season letter " + code);
        }
    }

    private boolean hasTrendOption() {
        for (TrendType trend : trendOptions) {
            if (trend.isPresent()) {
                return true;
            }
        }
        return false;
    }

    public void setDampedPolicy(DampedPolicy policy) {
        checkNotNull(policy, "policy cannot be null");
        if (policy == DampedPolicy.ALWAYS) {
            checkArgument(hasTrendOption(), "damping requires a trend");
        }
        this.dampedPolicy = policy;
    }

    /**
     * Multiplicative trends are generated for a Z trend letter only when this
     * is set; an explicit M always generates them.
     */
    public void setAllowMultiplicativeTrend(boolean allow) {
        this.allowMultiplicativeTrend = allow;
    }

    public boolean isSeasonal() {
        return seasonOptions.stream().anyMatch(SeasonType::isPresent);
    }

    /**
     * Lists candidate structures in a fixed order: error, then trend, then
     * season, then undamped before damped. Structures that need positive data
     * are left out when values contain a zero or negative observation, and
     * combinations the recursion does not support are left out always.
     *
     * @param values the training data
     * @return the candidates, possibly empty
     */
    public List<CandidateConfig> enumerateCandidates(double[] values) {
        checkNotNull(values, "values cannot be null");
        boolean nonPositive = hasNonPositive(values);
        List<CandidateConfig> result = new ArrayList<>();
        for (ErrorType error : errorOptions) {
            if (nonPositive && error.isMultiplicative()) {
                continue;
            }
            for (TrendType trend : trendOptions) {
                if (trend.isMultiplicative() && (nonPositive || !(multiplicativeTrendRequested
                        || allowMultiplicativeTrend))) {
                    continue;
                }
                for (SeasonType season : seasonOptions) {
                    if (nonPositive && season.isMultiplicative()) {
                        continue;
                    }
                    for (boolean damped : dampingOptions(trend)) {
                        if (SmoothingConfig.isSupported(error, TrendType.of(trend, damped), season)) {
                            result.add(new CandidateConfig(error, trend, season, damped));
                        }
                    }
                }
            }
        }
        return result;
    }

    private List<Boolean> dampingOptions(TrendType trend) {
        if (!trend.isPresent()) {
            return Collections.singletonList(false);
        }
        switch (dampedPolicy) {
        case ALWAYS:
            return Collections.singletonList(true);
        case NEVER:
            return Collections.singletonList(false);
        default:
            return List.of(false, true);
        }
    }
}
