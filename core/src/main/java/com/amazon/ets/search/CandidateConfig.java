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

import static com.amazon.ets.CommonUtils.checkNotNull;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One model structure in the search. The trend is held in undamped form with
 * damping as a separate flag.
 */
@Getter
@EqualsAndHashCode
public class CandidateConfig {

    private final ErrorType error;
    private final TrendType trend;
    private final SeasonType season;
    private final boolean damped;

    public CandidateConfig(ErrorType error, TrendType trend, SeasonType season, boolean damped) {
        this.error = checkNotNull(error, "error cannot be null");
        this.trend = checkNotNull(trend, "trend cannot be null").base();
        this.season = checkNotNull(season, "season cannot be null");
        this.damped = damped && this.trend.isPresent();
    }

    /**
     * @return the trend type with damping folded in
     */
    public TrendType getTrendType() {
        return TrendType.of(trend, damped);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(error.isMultiplicative() ? 'M' : 'A');
        builder.append(!trend.isPresent() ? 'N' : trend.isMultiplicative() ? 'M' : 'A');
        if (damped) {
            builder.append('d');
        }
        builder.append(!season.isPresent() ? 'N' : season.isMultiplicative() ? 'M' : 'A');
        return builder.toString();
    }
}
