/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cdxjtools.command.common;

import io.cdxjtools.index.OrderViolationPolicy;
import picocli.CommandLine;

/**
 * Shared option selecting what happens when input is found out of sort order.
 */
public class OrderPolicyOption {

    /** Converter for {@link OrderViolationPolicy} values */
    public static class Converter extends EnumOptionConverter<OrderViolationPolicy> {
        public Converter() {
            super(OrderViolationPolicy.class);
        }
    }

    @CommandLine.Option(
        names = {"--order-violation"},
        description = "On a record out of sort order: abort (default) or warn and continue",
        converter = Converter.class
    )
    private OrderViolationPolicy policy = OrderViolationPolicy.ABORT;

    public OrderViolationPolicy getPolicy() {
        return policy;
    }
}
