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

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.s3.uploadbenchmark.common.PrefixedConfiguration;

/**
 * Pre-obtained credentials passed through to every client. When neither access key nor secret key
 * is set, the SDK default provider chain is used instead.
 */
@Value
@Builder
public class AwsCredentialsConfiguration {
  public static final String ACCESS_KEY_ID_KEY = "KEY";
  public static final String SECRET_ACCESS_KEY_KEY = "SECRET";
  public static final String SESSION_TOKEN_KEY = "SESSION";

  public static final AwsCredentialsConfiguration DEFAULT =
      AwsCredentialsConfiguration.builder().build();

  String accessKeyId;
  @ToString.Exclude String secretAccessKey;
  @ToString.Exclude String sessionToken;

  /**
   * Creates the {@link AwsCredentialsConfiguration} from the supplied configuration
   *
   * @param configuration an instance of configuration
   * @return a new instance of {@link AwsCredentialsConfiguration}
   */
  public static AwsCredentialsConfiguration fromConfiguration(PrefixedConfiguration configuration) {
    return AwsCredentialsConfiguration.builder()
        .accessKeyId(Strings.emptyToNull(configuration.getString(ACCESS_KEY_ID_KEY, null)))
        .secretAccessKey(
            Strings.emptyToNull(configuration.getString(SECRET_ACCESS_KEY_KEY, null)))
        .sessionToken(Strings.emptyToNull(configuration.getString(SESSION_TOKEN_KEY, null)))
        .build();
  }

  /**
   * Builds the provider handed to the SDK client builders.
   *
   * @return a credentials provider
   * @throws IllegalArgumentException if only one of access key and secret key is set
   */
  public AwsCredentialsProvider toProvider() {
    if (accessKeyId == null && secretAccessKey == null) {
      return DefaultCredentialsProvider.create();
    }
    if (accessKeyId == null || secretAccessKey == null) {
      throw new IllegalArgumentException(
          String.format(
              "Both `%s` and `%s` must be set to use static credentials",
              ACCESS_KEY_ID_KEY, SECRET_ACCESS_KEY_KEY));
    }
    if (Strings.isNullOrEmpty(sessionToken)) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
    return StaticCredentialsProvider.create(
        AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken));
  }
}
