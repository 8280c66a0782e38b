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

package com.amazon.ets.config;

/**
 * The trend component of an exponential smoothing model. The damped variants
 * scale the trend contribution by a factor phi in (0, 1).
 */
public enum TrendType {
    /**
     * no trend component
     */
    NONE,
    /**
     * level plus trend
     */
    ADDITIVE,
    /**
     * level plus trend with the trend shrunk by phi at every step
     */
    DAMPED_ADDITIVE,
    /**
     * level times trend
     */
    MULTIPLICATIVE,
    /**
     * level times trend raised to phi
     */
    DAMPED_MULTIPLICATIVE;

    public boolean isPresent() {
        return this != NONE;
    }

    public boolean isDamped() {
        return this == DAMPED_ADDITIVE || this == DAMPED_MULTIPLICATIVE;
    }

    public boolean isMultiplicative() {
        return this == MULTIPLICATIVE || this == DAMPED_MULTIPLICATIVE;
    }

    /**
     * @return the undamped form of this trend
     */
    public TrendType base() {
        switch (this) {
        case DAMPED_ADDITIVE:
            return ADDITIVE;
        case DAMPED_MULTIPLICATIVE:
            return MULTIPLICATIVE;
        default:
            return this;
        }
    }

    /**
     * Combines an undamped trend with a damping flag.
     *
     * @param base   one of NONE, ADDITIVE or MULTIPLICATIVE
     * @param damped whether the trend is damped; ignored for NONE
     * @return the combined trend type
     */
    public static TrendType of(TrendType base, boolean damped) {
        switch (base.base()) {
        case ADDITIVE:
            return damped ? DAMPED_ADDITIVE : ADDITIVE;
        case MULTIPLICATIVE:
            return damped ? DAMPED_MULTIPLICATIVE : MULTIPLICATIVE;
        default:
            return NONE;
        }
    }
}
