/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
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
package software.amazon.s3.uploadbenchmark;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.s3.uploadbenchmark.client.S3ClientFactory;
import software.amazon.s3.uploadbenchmark.common.telemetry.Attribute;
import software.amazon.s3.uploadbenchmark.common.telemetry.OperationMeasurement;
import software.amazon.s3.uploadbenchmark.common.telemetry.Telemetry;
import software.amazon.s3.uploadbenchmark.common.telemetry.TelemetryReporter;
import software.amazon.s3.uploadbenchmark.dataset.DatasetLoader;
import software.amazon.s3.uploadbenchmark.dataset.DatasetPartitioner;
import software.amazon.s3.uploadbenchmark.key.RunId;
import software.amazon.s3.uploadbenchmark.strategy.TransferFacility;

@SuppressFBWarnings(
    value = "NP_NONNULL_PARAM_VIOLATION",
    justification = "We mean to pass nulls to checks")
public class UploadBenchmarkTest {
  private static final long SEED = 5;
  private static final int PARTITIONS = 6;

  private S3ClientFactory factory;
  private TransferFacility facility;
  private List<S3Client> perTaskClients;
  private S3Client sharedClient;
  private TelemetryReporter reporter;

  private static S3Client client() {
    S3Client client = mock(S3Client.class);
    when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenReturn(PutObjectResponse.builder().build());
    return client;
  }

  private static UploadBenchmarkConfiguration configuration(String datasetUrl) {
    return UploadBenchmarkConfiguration.builder()
        .bucket("bucket")
        .datasetUrl(datasetUrl)
        .groupingColumns(Arrays.asList("color", "payment", "pickup_zone"))
        .concurrencyLevel(2)
        .build();
  }

  private static String sampleUrl() {
    return UploadBenchmarkTest.class.getResource("/taxis-sample.csv").toString();
  }

  @BeforeEach
  void setUp() {
    factory = mock(S3ClientFactory.class);
    facility = mock(TransferFacility.class);
    perTaskClients = Arrays.asList(client(), client());
    sharedClient = client();
    reporter = mock(TelemetryReporter.class);
    when(factory.getConcurrency()).thenReturn(2);
    when(factory.createTransferFacility()).thenReturn(facility);
    when(factory.createClients(2)).thenReturn(perTaskClients);
    when(factory.createClient()).thenReturn(sharedClient);
  }

  private UploadBenchmark benchmark(UploadBenchmarkConfiguration configuration) {
    return new UploadBenchmark(
        configuration,
        factory,
        new DatasetLoader(),
        new DatasetPartitioner(),
        Telemetry.createDefault(),
        reporter,
        new Random(SEED));
  }

  @Test
  void testRunsEveryStrategyInOrder() throws IOException, InterruptedException {
    List<OperationMeasurement> measurements = benchmark(configuration(sampleUrl())).run();

    assertEquals(
        Arrays.asList("transfer", "multithread_client", "multithread_shared_client"),
        measurements.stream().map(m -> m.getOperation().getName()).collect(Collectors.toList()));
    for (OperationMeasurement measurement : measurements) {
      assertEquals(
          2,
          measurement
              .getOperation()
              .getAttribute(UploadBenchmark.CONCURRENCY_ATTRIBUTE)
              .map(Attribute::getValue)
              .orElse(null));
    }
    ArgumentCaptor<OperationMeasurement> reported =
        ArgumentCaptor.forClass(OperationMeasurement.class);
    verify(reporter, times(3)).report(reported.capture());
    assertEquals(measurements, reported.getAllValues());
  }

  @Test
  void testUploadsEveryPartitionPerStrategy() throws IOException, InterruptedException {
    benchmark(configuration(sampleUrl())).run();
    String runId = RunId.random(new Random(SEED)).getValue();

    ArgumentCaptor<String> managedKeys = ArgumentCaptor.forClass(String.class);
    verify(facility, times(PARTITIONS))
        .submit(any(byte[].class), eq("bucket"), managedKeys.capture());
    assertTrue(
        managedKeys.getAllValues().contains(
            "run="
                + runId
                + "/method=manager/color=green/payment=credit card/pickup_zone=Hudson Sq, SoHo"
                + "/data.csv"));
    assertTrue(
        managedKeys.getAllValues().contains(
            "run=" + runId + "/method=manager/color=yellow/payment=/pickup_zone=Lenox Hill West"
                + "/data.csv"));

    List<String> perTaskKeys = new ArrayList<>();
    for (S3Client client : perTaskClients) {
      ArgumentCaptor<PutObjectRequest> requests = ArgumentCaptor.forClass(PutObjectRequest.class);
      verify(client, atLeast(0)).putObject(requests.capture(), any(RequestBody.class));
      requests.getAllValues().forEach(request -> perTaskKeys.add(request.key()));
    }
    assertEquals(PARTITIONS, perTaskKeys.size());
    assertTrue(
        perTaskKeys.stream()
            .allMatch(key -> key.startsWith("run=" + runId + "/method=clients[2]/")));

    ArgumentCaptor<PutObjectRequest> shared = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(sharedClient, times(PARTITIONS)).putObject(shared.capture(), any(RequestBody.class));
    Set<String> sharedKeys = new HashSet<>();
    shared.getAllValues().forEach(request -> sharedKeys.add(request.key()));
    assertEquals(PARTITIONS, sharedKeys.size());
    assertTrue(
        sharedKeys.stream().allMatch(key -> key.startsWith("run=" + runId + "/method=client/")));
  }

  @Test
  void testStrategiesAreClosedAndReportedAfterwards() throws IOException, InterruptedException {
    benchmark(configuration(sampleUrl())).run();

    InOrder inOrder = inOrder(facility, sharedClient, reporter);
    inOrder.verify(facility).awaitAll();
    inOrder.verify(facility).close();
    inOrder.verify(sharedClient).close();
    inOrder.verify(reporter, times(3)).report(any(OperationMeasurement.class));
    perTaskClients.forEach(client -> verify(client).close());
  }

  @Test
  void testUploadFailureStopsTheRun() {
    when(sharedClient.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().message("Access Denied").statusCode(403).build());

    assertThrows(S3Exception.class, () -> benchmark(configuration(sampleUrl())).run());
    verify(reporter, never()).report(any(OperationMeasurement.class));
    verify(sharedClient).close();
  }

  @Test
  void testUnreachableDatasetFailsBeforeCreatingClients() {
    UploadBenchmark benchmark = benchmark(configuration("file:/nonexistent/taxis.csv"));

    assertThrows(IOException.class, benchmark::run);
    verify(factory, never()).createTransferFacility();
    verify(factory, never()).createClient();
  }

  @Test
  void testUnknownGroupingColumn() {
    UploadBenchmarkConfiguration configuration =
        UploadBenchmarkConfiguration.builder()
            .bucket("bucket")
            .datasetUrl(sampleUrl())
            .groupingColumn("vendor")
            .concurrencyLevel(2)
            .build();

    assertThrows(IllegalArgumentException.class, () -> benchmark(configuration).run());
    verify(facility, never()).submit(any(byte[].class), anyString(), anyString());
  }

  @Test
  void testNulls() {
    assertThrows(NullPointerException.class, () -> new UploadBenchmark(null, 4));
  }
}
