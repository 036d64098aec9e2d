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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.Mockito.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3CrtAsyncClientBuilder;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;
import software.amazon.s3.uploadbenchmark.strategy.S3TransferManagerFacility;
import software.amazon.s3.uploadbenchmark.strategy.TransferFacility;

@SuppressFBWarnings(
    value = "NP_NONNULL_PARAM_VIOLATION",
    justification = "We mean to pass nulls to checks")
public class S3ClientFactoryTest {
  private static final S3ClientFactoryConfiguration CONFIGURATION =
      S3ClientFactoryConfiguration.builder()
          .endpoint(URI.create("http://localhost:9000"))
          .forcePathStyle(true)
          .credentials(
              AwsCredentialsConfiguration.builder()
                  .accessKeyId("AKID")
                  .secretAccessKey("secret")
                  .build())
          .build();

  @Test
  void testDefaults() {
    S3ClientFactoryConfiguration configuration =
        S3ClientFactoryConfiguration.fromConfiguration(
            new PrefixedConfiguration(new HashMap<>(), ""));

    assertEquals(Region.EU_WEST_1, configuration.getRegion());
    assertNull(configuration.getEndpoint());
    assertFalse(configuration.isForcePathStyle());
    assertEquals(AwsCredentialsConfiguration.DEFAULT, configuration.getCredentials());
  }

  @Test
  void testFromConfiguration() {
    Map<String, String> map = new HashMap<>();
    map.put("REGION", "us-east-2");
    map.put("ENDPOINT", "http://localhost:9000");
    map.put("FORCE_PATH_STYLE", "true");
    map.put("KEY", "AKID");
    map.put("SECRET", "secret");

    S3ClientFactoryConfiguration configuration =
        S3ClientFactoryConfiguration.fromConfiguration(new PrefixedConfiguration(map, ""));

    assertEquals(Region.US_EAST_2, configuration.getRegion());
    assertEquals(URI.create("http://localhost:9000"), configuration.getEndpoint());
    assertTrue(configuration.isForcePathStyle());
    assertEquals("AKID", configuration.getCredentials().getAccessKeyId());
  }

  @Test
  void testConstructorValidatesArguments() {
    assertThrows(NullPointerException.class, () -> new S3ClientFactory(null, 4));
    assertThrows(IllegalArgumentException.class, () -> new S3ClientFactory(CONFIGURATION, 0));
  }

  @Test
  void testCreateClientsBuildsIndependentClients() {
    S3ClientFactory factory = new S3ClientFactory(CONFIGURATION, 2);
    List<S3Client> clients = factory.createClients(3);
    try {
      assertEquals(3, clients.size());
      assertNotSame(clients.get(0), clients.get(1));
      assertNotSame(clients.get(1), clients.get(2));
    } finally {
      clients.forEach(S3Client::close);
    }
    assertThrows(IllegalArgumentException.class, () -> factory.createClients(0));
  }

  @Test
  void testClientConnectionPoolIsSizedToConcurrency() {
    ApacheHttpClient.Builder httpClientBuilder =
        mock(ApacheHttpClient.Builder.class, delegatesTo(ApacheHttpClient.builder()));
    S3ClientFactory factory = spy(new S3ClientFactory(CONFIGURATION, 7));
    doReturn(httpClientBuilder).when(factory).newHttpClientBuilder();

    try (S3Client client = factory.createClient()) {
      assertNotNull(client);
    }
    verify(httpClientBuilder).maxConnections(7);
  }

  @Test
  void testCreateClientsClosesBuiltClientsOnFailure() {
    S3Client first = mock(S3Client.class);
    S3Client second = mock(S3Client.class);
    SdkClientException failure = SdkClientException.create("no credentials");
    S3ClientFactory factory = spy(new S3ClientFactory(CONFIGURATION, 2));
    doReturn(first).doReturn(second).doThrow(failure).when(factory).createClient();
    IllegalStateException closeFailure = new IllegalStateException("already closed");
    doThrow(closeFailure).when(second).close();

    SdkClientException thrown =
        assertThrows(SdkClientException.class, () -> factory.createClients(4));
    assertSame(failure, thrown);
    assertArrayEquals(new Throwable[] {closeFailure}, thrown.getSuppressed());
    verify(first).close();
    verify(second).close();
    verify(factory, times(3)).createClient();
  }

  @Test
  void testCrtClientConcurrencyAndEndpoint() {
    S3AsyncClient crtClient = mock(S3AsyncClient.class);
    S3CrtAsyncClientBuilder crtClientBuilder = mock(S3CrtAsyncClientBuilder.class, RETURNS_SELF);
    when(crtClientBuilder.build()).thenReturn(crtClient);
    S3ClientFactory factory = spy(new S3ClientFactory(CONFIGURATION, 6));
    doReturn(crtClientBuilder).when(factory).newCrtClientBuilder();

    assertSame(crtClient, factory.createCrtClient());
    verify(crtClientBuilder).maxConcurrency(6);
    verify(crtClientBuilder).region(Region.EU_WEST_1);
    verify(crtClientBuilder).forcePathStyle(true);
    verify(crtClientBuilder).endpointOverride(URI.create("http://localhost:9000"));
  }

  @Test
  void testTransferFacilityOwnsItsCrtClient() {
    S3AsyncClient crtClient = mock(S3AsyncClient.class);
    S3CrtAsyncClientBuilder crtClientBuilder = mock(S3CrtAsyncClientBuilder.class, RETURNS_SELF);
    when(crtClientBuilder.build()).thenReturn(crtClient);
    S3TransferManager transferManager = mock(S3TransferManager.class);
    S3ClientFactory factory = spy(new S3ClientFactory(CONFIGURATION, 3));
    doReturn(crtClientBuilder).when(factory).newCrtClientBuilder();
    doReturn(transferManager).when(factory).newTransferManager(crtClient);

    TransferFacility facility = factory.createTransferFacility();
    assertInstanceOf(S3TransferManagerFacility.class, facility);
    assertSame(transferManager, ((S3TransferManagerFacility) facility).getTransferManager());
    verify(crtClientBuilder).maxConcurrency(3);
    verify(crtClient, never()).close();

    facility.close();
    verify(transferManager).close();
    verify(crtClient).close();
  }

  @Test
  void testTransferManagerFailureClosesCrtClient() {
    S3AsyncClient crtClient = mock(S3AsyncClient.class);
    S3CrtAsyncClientBuilder crtClientBuilder = mock(S3CrtAsyncClientBuilder.class, RETURNS_SELF);
    when(crtClientBuilder.build()).thenReturn(crtClient);
    S3ClientFactory factory = spy(new S3ClientFactory(CONFIGURATION, 3));
    doReturn(crtClientBuilder).when(factory).newCrtClientBuilder();
    doThrow(new IllegalStateException("boom")).when(factory).newTransferManager(crtClient);

    assertThrows(IllegalStateException.class, factory::createTransferFacility);
    verify(crtClient).close();
  }
}
