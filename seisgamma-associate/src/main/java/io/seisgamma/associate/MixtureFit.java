package io.seisgamma.associate;

/*
 * Copyright (c) seisgamma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.List;

/// Result of one association fit.
///
/// @param events fitted components, in component order
/// @param responsibilities soft assignment matrix (n_picks x n_components), rows sum to 1
/// @param logLikelihood final weighted mean log-likelihood per pick
/// @param iterations number of EM iterations run
/// @param converged whether the log-likelihood change fell below `tol` before `max_iter`
public record MixtureFit(
    List<EventHypothesis> events,
    double[][] responsibilities,
    double logLikelihood,
    int iterations,
    boolean converged
) {

    public MixtureFit {
        events = List.copyOf(events);
    }

    /// Returns the number of components.
    public int numComponents() {
        return events.size();
    }

    /// Returns hard assignments by maximum responsibility; ties go to the lower component.
    public int[] hardAssignments() {
        int[] assignments = new int[responsibilities.length];
        for (int i = 0; i < responsibilities.length; i++) {
            assignments[i] = argmax(responsibilities[i]);
        }
        return assignments;
    }

    private static int argmax(double[] values) {
        int best = 0;
        for (int k = 1; k < values.length; k++) {
            if (values[k] > values[best]) {
                best = k;
            }
        }
        return best;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("MixtureFit[k=%d, LL=%.3f, iters=%d, converged=%s]%n",
            events.size(), logLikelihood, iterations, converged));
        for (int k = 0; k < events.size(); k++) {
            sb.append(String.format("  Component %d: %s%n", k, events.get(k)));
        }
        return sb.toString();
    }
}
