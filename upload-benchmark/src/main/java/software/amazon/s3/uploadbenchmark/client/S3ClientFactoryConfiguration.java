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

import java.net.URI;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import software.amazon.awssdk.regions.Region;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;

/** Settings shared by every client the {@link S3ClientFactory} builds. */
@Value
@Builder
public class S3ClientFactoryConfiguration {
  public static final String REGION_KEY = "REGION";
  public static final String ENDPOINT_KEY = "ENDPOINT";
  public static final String FORCE_PATH_STYLE_KEY = "FORCE_PATH_STYLE";

  public static final String DEFAULT_REGION = "eu-west-1";
  public static final boolean DEFAULT_FORCE_PATH_STYLE = false;

  @Builder.Default @NonNull Region region = Region.of(DEFAULT_REGION);

  /** Endpoint override; {@code null} means the regional AWS endpoint. */
  URI endpoint;

  @Builder.Default boolean forcePathStyle = DEFAULT_FORCE_PATH_STYLE;

  @Builder.Default @NonNull
  AwsCredentialsConfiguration credentials = AwsCredentialsConfiguration.DEFAULT;

  /**
   * Creates the {@link S3ClientFactoryConfiguration} from the supplied configuration
   *
   * @param configuration an instance of configuration
   * @return a new instance of {@link S3ClientFactoryConfiguration}
   */
  public static S3ClientFactoryConfiguration fromConfiguration(
      PrefixedConfiguration configuration) {
    String endpoint = configuration.getString(ENDPOINT_KEY, "");
    return S3ClientFactoryConfiguration.builder()
        .region(Region.of(configuration.getString(REGION_KEY, DEFAULT_REGION)))
        .endpoint(endpoint.isEmpty() ? null : URI.create(endpoint))
        .forcePathStyle(configuration.getBoolean(FORCE_PATH_STYLE_KEY, DEFAULT_FORCE_PATH_STYLE))
        .credentials(AwsCredentialsConfiguration.fromConfiguration(configuration))
        .build();
  }
}
