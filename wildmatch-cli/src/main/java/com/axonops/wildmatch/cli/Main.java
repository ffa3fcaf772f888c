/*
 * Copyright 2025 AxonOps
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

package com.axonops.wildmatch.cli;

import com.axonops.wildmatch.exception.InvalidPatternException;
import com.axonops.wildmatch.api.MatchEngine;
import com.axonops.wildmatch.api.Pattern;
import com.axonops.wildmatch.config.WildmatchConfig;
import com.axonops.wildmatch.engine.BacktrackingMatcher;
import com.axonops.wildmatch.engine.FullMatcher;
import com.axonops.wildmatch.engine.LoggingTraceListener;
import com.axonops.wildmatch.selftest.RegressionScenarios;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * wildmatch [--engine BACKTRACKING|MEMOIZED] [--trace] [--verbose] TEXT PATTERN
 * wildmatch [--trace] test_cases
 * </pre>
 *
 * Exit status: 0 on success, 1 when a regression scenario fails, 2 on a usage error and 128 when
 * the pattern is malformed.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /** First argument that selects the regression run instead of a single match. */
    public static final String SELF_TEST = "test_cases";

    static final int EXIT_OK = 0;
    static final int EXIT_SELF_TEST_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FATAL = 128;

    @Option(name = "--help", aliases = { "-h" }, usage = "display this help text")
    private boolean help;

    @Option(name = "--engine", metaVar = "ENGINE", usage = "match engine: BACKTRACKING (default) or MEMOIZED")
    private MatchEngine engine = MatchEngine.BACKTRACKING;

    @Option(name = "--trace", usage = "log every backtracking state transition to " + LoggingTraceListener.LOGGER_NAME)
    private boolean trace;

    @Option(name = "--verbose", aliases = { "-v" }, usage = "also describe the result on standard error")
    private boolean verbose;

    @Argument(index = 0, metaVar = "TEXT", usage = "input string, or " + SELF_TEST + " to run the regression scenarios")
    private String text;

    @Argument(index = 1, metaVar = "PATTERN", usage = "pattern using '.' and '*'")
    private String pattern;

    public static void main(String[] argv) {
        System.exit(new Main().run(argv, System.out, System.err));
    }

    /**
     * Parses {@code argv} and executes the requested command.
     *
     * @return process exit status
     */
    int run(String[] argv, PrintStream out, PrintStream err) {
        CmdLineParser clp = new CmdLineParser(this);
        try {
            clp.parseArgument(argv);
        } catch (CmdLineException e) {
            err.println("fatal: " + e.getMessage());
            printUsage(clp, err);
            return EXIT_USAGE;
        }

        if (help) {
            printUsage(clp, out);
            return EXIT_OK;
        }
        if (text == null) {
            printUsage(clp, err);
            return EXIT_USAGE;
        }
        if (pattern == null) {
            if (SELF_TEST.equals(text)) {
                return runSelfTest(out);
            }
            err.println("fatal: PATTERN is required");
            printUsage(clp, err);
            return EXIT_USAGE;
        }

        try {
            return runMatch(out, err);
        } catch (InvalidPatternException e) {
            err.println("fatal: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private int runMatch(PrintStream out, PrintStream err) {
        WildmatchConfig.Builder config = WildmatchConfig.builder().engine(engine);
        if (trace) {
            config.traceListener(LoggingTraceListener.INSTANCE);
        }

        boolean matched = Pattern.compile(pattern, config.build()).matches(text);
        logger.debug("Wildmatch: CLI match - engine: {}, result: {}", engine, matched);

        out.println(matched);
        if (verbose) {
            err.println(matched
                ? "input string '" + text + "' matches pattern '" + pattern + "'"
                : "input string '" + text + "' DOES NOT MATCH pattern '" + pattern + "'");
        }
        return EXIT_OK;
    }

    private int runSelfTest(PrintStream out) {
        boolean passed = true;

        for (MatchEngine e : MatchEngine.values()) {
            List<RegressionScenarios.Scenario> failures = RegressionScenarios.failures(matcherFor(e));
            int total = RegressionScenarios.SCENARIOS.size();
            out.println(e + ": " + (total - failures.size()) + "/" + total + " scenarios passed");
            for (RegressionScenarios.Scenario failure : failures) {
                out.println("  FAILED " + failure);
            }
            passed &= failures.isEmpty();
        }

        List<String> accepted = RegressionScenarios.acceptedMalformedPatterns();
        for (String malformed : accepted) {
            out.println("  FAILED malformed pattern accepted: \"" + malformed + "\"");
        }
        passed &= accepted.isEmpty();

        out.println(passed ? "all scenarios passed" : "regression scenarios FAILED");
        return passed ? EXIT_OK : EXIT_SELF_TEST_FAILED;
    }

    private FullMatcher matcherFor(MatchEngine e) {
        if (trace && e == MatchEngine.BACKTRACKING) {
            return new BacktrackingMatcher(LoggingTraceListener.INSTANCE);
        }
        return e.matcher();
    }

    private static void printUsage(CmdLineParser clp, PrintStream stream) {
        stream.print("wildmatch");
        clp.printSingleLineUsage(stream);
        stream.println();
        stream.println();
        clp.printUsage(stream);
    }
}
