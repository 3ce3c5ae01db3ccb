/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.starflow.runtime.cli;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Maps;
import com.typesafe.config.ConfigException;

import lombok.extern.slf4j.Slf4j;

import org.apache.starflow.configuration.State;
import org.apache.starflow.runtime.RunOutcome;
import org.apache.starflow.runtime.StarSchemaJobLauncher;


/**
 * Command line entry point: runs the job described by a configuration file once and prints its outcome as JSON.
 *
 * <p>
 *   Exits with {@value #EXIT_SUCCESS} when a new snapshot was published, {@value #EXIT_FAILURE} when the run
 *   failed or was cancelled and {@value #EXIT_USAGE} when the arguments or the configuration are invalid.
 * </p>
 */
@Slf4j
public class StarflowCli {

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  private static final Option CONF_OPTION = Option.builder("c").argName("job configuration file")
      .desc("Job configuration file, HOCON or .properties").hasArg().longOpt("conf").build();
  private static final Option OVERRIDE_OPTION = Option.builder("D").argName("key=value")
      .desc("Override a configuration property").numberOfArgs(2).valueSeparator('=').build();
  private static final Option HELP_OPTION =
      Option.builder("h").argName("help").desc("Display usage information").longOpt("help").build();

  private final PrintStream out;
  private final PrintStream err;

  public StarflowCli(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new StarflowCli(System.out, System.err).run(args));
  }

  /**
   * @return the exit code of the process
   */
  public int run(String[] args) {
    CommandLine cmd;
    try {
      cmd = new DefaultParser().parse(options(), args);
    } catch (ParseException pe) {
      this.err.println(pe.getMessage());
      printUsage();
      return EXIT_USAGE;
    }

    if (cmd.hasOption(HELP_OPTION.getOpt())) {
      printUsage();
      return EXIT_SUCCESS;
    }
    if (!cmd.hasOption(CONF_OPTION.getOpt())) {
      this.err.println("Missing required option: " + CONF_OPTION.getOpt());
      printUsage();
      return EXIT_USAGE;
    }

    StarSchemaJobLauncher launcher;
    try {
      State jobState = JobConfigLoader.load(new File(cmd.getOptionValue(CONF_OPTION.getOpt())), overrides(cmd));
      launcher = newLauncher(jobState);
    } catch (IllegalArgumentException | ConfigException e) {
      log.error("Invalid job configuration", e);
      this.err.println("Invalid job configuration: " + e.getMessage());
      return EXIT_USAGE;
    }

    RunOutcome outcome = launcher.launchJob();
    this.out.println(outcome.toJson());
    return outcome.isSuccessful() ? EXIT_SUCCESS : EXIT_FAILURE;
  }

  @VisibleForTesting
  protected StarSchemaJobLauncher newLauncher(State jobState) {
    return new StarSchemaJobLauncher(jobState);
  }

  private static Map<String, String> overrides(CommandLine cmd) {
    Properties properties = cmd.getOptionProperties(OVERRIDE_OPTION.getOpt());
    return Maps.fromProperties(properties);
  }

  private void printUsage() {
    PrintWriter writer = new PrintWriter(this.err);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(writer, formatter.getWidth(), StarflowCli.class.getSimpleName() + " -c <file> [-D key=value]",
        null, options(), formatter.getLeftPadding(), formatter.getDescPadding(), null);
    writer.flush();
  }

  private static Options options() {
    Options options = new Options();
    options.addOption(CONF_OPTION);
    options.addOption(OVERRIDE_OPTION);
    options.addOption(HELP_OPTION);
    return options;
  }
}
