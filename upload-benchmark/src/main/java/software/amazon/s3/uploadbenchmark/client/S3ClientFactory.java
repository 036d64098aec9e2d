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
package software.amazon.s3.uploadbenchmark.client;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NonNull;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3CrtAsyncClientBuilder;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.s3.uploadbenchmark.strategy.S3TransferManagerFacility;
import software.amazon.s3.uploadbenchmark.strategy.TransferFacility;

/**
 * Builds the clients used by the upload strategies. Every client built here has its own connection
 * pool sized to the concurrency the factory was created with. Construction failures propagate.
 */
@Getter
public class S3ClientFactory {
  @NonNull private final S3ClientFactoryConfiguration configuration;
  private final int concurrency;

  /**
   * Creates a new instance of {@link S3ClientFactory}
   *
   * @param configuration client settings
   * @param concurrency connection pool size of each client
   */
  public S3ClientFactory(@NonNull S3ClientFactoryConfiguration configuration, int concurrency) {
    Preconditions.checkArgument(concurrency > 0, "`concurrency` must be positive");
    this.configuration = configuration;
    this.concurrency = concurrency;
  }

  /**
   * Builds a synchronous client backed by an Apache HTTP client with {@code concurrency}
   * connections.
   *
   * @return a new {@link S3Client}
   */
  public S3Client createClient() {
    S3ClientBuilder builder =
        S3Client.builder()
            .region(configuration.getRegion())
            .credentialsProvider(configuration.getCredentials().toProvider())
            .forcePathStyle(configuration.isForcePathStyle())
            .httpClientBuilder(newHttpClientBuilder().maxConnections(concurrency));
    if (configuration.getEndpoint() != null) {
      builder.endpointOverride(configuration.getEndpoint());
    }
    return builder.build();
  }

  /**
   * Builds {@code count} independent clients. If any of them cannot be built, the ones built so
   * far are closed before the failure propagates.
   *
   * @param count number of clients
   * @return the clients
   */
  public List<S3Client> createClients(int count) {
    Preconditions.checkArgument(count > 0, "`count` must be positive");
    List<S3Client> clients = new ArrayList<>(count);
    try {
      for (int i = 0; i < count; i++) {
        clients.add(createClient());
      }
    } catch (RuntimeException e) {
      for (S3Client client : clients) {
        closeAfterFailure(client, e);
      }
      throw e;
    }
    return clients;
  }

  /**
   * Builds a CRT based asynchronous client limited to {@code concurrency} concurrent requests.
   *
   * @return a new {@link S3AsyncClient}
   */
  public S3AsyncClient createCrtClient() {
    S3CrtAsyncClientBuilder builder =
        newCrtClientBuilder()
            .region(configuration.getRegion())
            .credentialsProvider(configuration.getCredentials().toProvider())
            .forcePathStyle(configuration.isForcePathStyle())
            .maxConcurrency(concurrency);
    if (configuration.getEndpoint() != null) {
      builder.endpointOverride(configuration.getEndpoint());
    }
    return builder.build();
  }

  /**
   * Builds a transfer facility over a fresh CRT client. Closing the facility closes the client.
   *
   * @return a new {@link TransferFacility}
   */
  public TransferFacility createTransferFacility() {
    S3AsyncClient s3AsyncClient = createCrtClient();
    S3TransferManager transferManager;
    try {
      transferManager = newTransferManager(s3AsyncClient);
    } catch (RuntimeException e) {
      closeAfterFailure(s3AsyncClient, e);
      throw e;
    }
    return new S3TransferManagerFacility(transferManager, s3AsyncClient);
  }

  ApacheHttpClient.Builder newHttpClientBuilder() {
    return ApacheHttpClient.builder();
  }

  S3CrtAsyncClientBuilder newCrtClientBuilder() {
    return S3AsyncClient.crtBuilder();
  }

  S3TransferManager newTransferManager(S3AsyncClient s3AsyncClient) {
    return S3TransferManager.builder().s3Client(s3AsyncClient).build();
  }

  private static void closeAfterFailure(SdkAutoCloseable resource, RuntimeException failure) {
    try {
      resource.close();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }
}
