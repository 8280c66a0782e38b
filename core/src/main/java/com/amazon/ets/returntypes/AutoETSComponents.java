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

package com.amazon.ets.returntypes;

import com.amazon.ets.config.ErrorType;
import com.amazon.ets.config.SeasonType;
import com.amazon.ets.config.TrendType;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The structure of the selected model. The trend is reported in its undamped
 * form with damping carried separately.
 */
@Getter
@ToString
@AllArgsConstructor
public class AutoETSComponents {

    private final ErrorType error;
    private final TrendType trend;
    private final SeasonType season;
    private final boolean damped;
    private final int seasonLength;

    /**
     * @return the three or four letter code such as "MAdM"
     */
    public String code() {
        StringBuilder builder = new StringBuilder();
        builder.append(error.isMultiplicative() ? 'M' : 'A');
        builder.append(letter(trend.isPresent(), trend.isMultiplicative()));
        if (damped && trend.isPresent()) {
            builder.append('d');
        }
        builder.append(letter(season.isPresent(), season.isMultiplicative()));
        return builder.toString();
    }

    private static char letter(boolean present, boolean multiplicative) {
        return !present ? 'N' : multiplicative ? 'M' : 'A';
    }
}
