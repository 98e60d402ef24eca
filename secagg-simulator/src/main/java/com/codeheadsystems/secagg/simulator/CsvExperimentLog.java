package com.codeheadsystems.secagg.simulator;

import com.codeheadsystems.secagg.simulator.exceptions.SimulationException;
import com.codeheadsystems.secagg.simulator.model.ClientTimings;
import com.codeheadsystems.secagg.simulator.model.CommunicationReport;
import com.codeheadsystems.secagg.simulator.model.ExperimentResult;
import com.codeheadsystems.secagg.simulator.model.ServerTimings;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends experiment measurements to three CSV files in one directory: client computation,
 * server computation and communication analysis. Files are truncated and given a header on open.
 */
public class CsvExperimentLog implements AutoCloseable {

  public static final String CLIENT_LOG = "log_computation_client.csv";
  public static final String SERVER_LOG = "log_computation_server.csv";
  public static final String COMMUNICATION_LOG = "log_communication_analysis.csv";

  static final String CLIENT_HEADER = "Experiment,NumClients,DataSize,RingDimension,ClientID,"
      + "T_KeyGen_MKCKKS_ms,T_KeyGen_ECDH_ms,T_KeyGen_Total_ms,T_Encrypt_ms,T_MaskGen_ms,T_ClientTotal_ms";
  static final String SERVER_HEADER = "Experiment,NumClients,DataSize,RingDimension,"
      + "T_Aggregate_ms,T_Decode_ms,T_ServerTotal_ms";
  static final String COMMUNICATION_HEADER = "Experiment,NumClients,DataSize,RingDimension,"
      + "PlaintextBytes,CiphertextBytes,ClientUplinkBytes,SetupBytes,FinalDownlinkBytes,"
      + "CiphertextExpansion,CommExpansion";

  private static final Logger log = LoggerFactory.getLogger(CsvExperimentLog.class);

  private final BufferedWriter clientLog;
  private final BufferedWriter serverLog;
  private final BufferedWriter communicationLog;

  /**
   * Creates the directory if needed and opens the three logs.
   *
   * @param directory the output directory
   * @throws IOException if a file cannot be created
   */
  public CsvExperimentLog(final Path directory) throws IOException {
    Files.createDirectories(directory);
    this.clientLog = open(directory.resolve(CLIENT_LOG), CLIENT_HEADER);
    try {
      this.serverLog = open(directory.resolve(SERVER_LOG), SERVER_HEADER);
    } catch (IOException e) {
      closeQuietly(e, clientLog);
      throw e;
    }
    try {
      this.communicationLog = open(directory.resolve(COMMUNICATION_LOG), COMMUNICATION_HEADER);
    } catch (IOException e) {
      closeQuietly(e, clientLog, serverLog);
      throw e;
    }
    log.info("CsvExperimentLog({})", directory);
  }

  // Failures while closing are attached to the open failure.
  private static void closeQuietly(final IOException failure, final BufferedWriter... writers) {
    for (BufferedWriter writer : writers) {
      try {
        writer.close();
      } catch (IOException e) {
        failure.addSuppressed(e);
      }
    }
  }

  private static BufferedWriter open(final Path file, final String header) throws IOException {
    final BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    writer.write(header);
    writer.newLine();
    return writer;
  }

  /**
   * Writes one row per client, one server row and one communication row.
   *
   * @param result the measurements
   */
  public synchronized void record(final ExperimentResult result) {
    final String prefix = String.join(",",
        result.experiment().name(),
        Integer.toString(result.experiment().numClients()),
        Integer.toString(result.experiment().dataSize()),
        Integer.toString(result.ringDimension()));
    try {
      for (ClientTimings t : result.clientTimings()) {
        clientLog.write(prefix + "," + t.clientId() + ","
            + ms(t.keyGenMkCkksMs()) + "," + ms(t.keyGenEcdhMs()) + "," + ms(t.keyGenTotalMs()) + ","
            + ms(t.encryptMs()) + "," + ms(t.maskGenMs()) + "," + ms(t.clientTotalMs()));
        clientLog.newLine();
      }
      final ServerTimings s = result.serverTimings();
      serverLog.write(prefix + "," + ms(s.aggregateMs()) + "," + ms(s.decodeMs()) + "," + ms(s.serverTotalMs()));
      serverLog.newLine();
      final CommunicationReport c = result.communication();
      communicationLog.write(prefix + "," + c.plaintextBytes() + "," + c.ciphertextBytes() + ","
          + c.clientUplinkBytes() + "," + c.setupBytes() + "," + c.finalDownlinkBytes() + ","
          + ratio(c.ciphertextExpansion()) + "," + ratio(c.commExpansion()));
      communicationLog.newLine();
      clientLog.flush();
      serverLog.flush();
      communicationLog.flush();
    } catch (IOException e) {
      throw new SimulationException("Unable to write experiment logs", e);
    }
  }

  private static String ms(final double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  private static String ratio(final double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  @Override
  public void close() throws IOException {
    try (clientLog; serverLog; communicationLog) {
      log.debug("close()");
    }
  }
}
