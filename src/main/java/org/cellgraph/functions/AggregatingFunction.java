/*
 * Copyright 2025 The cellgraph Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.cellgraph.functions;

/**
 * A function of any number of arguments from a given position onwards, such as SUM. Those
 * arguments are combined into a single column before the call.
 */
public class AggregatingFunction extends Function {
  AggregatingFunction(Builder builder, int from) {
    super(builder.arity(from + 1, -1).prepare(Preparation.aggregateFrom(from)));
  }
}
