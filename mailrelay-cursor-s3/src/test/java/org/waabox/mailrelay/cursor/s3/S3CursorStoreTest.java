package org.waabox.mailrelay.cursor.s3;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.easymock.Capture;
import org.junit.jupiter.api.Test;
import org.waabox.mailrelay.cursor.CursorStoreException;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Tests for {@link S3CursorStore}.
 *
 * <p>Uses EasyMock to mock the S3Client since unit tests cannot depend
 * on a real AWS S3 bucket.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class S3CursorStoreTest {

  private static S3CursorStore store(final S3Client s3Client) {
    return new S3CursorStore(S3CursorConfig.builder()
        .bucket("relay-bucket")
        .region(Region.US_EAST_1)
        .s3Client(s3Client)
        .build());
  }

  @Test
  void whenWriting_givenCursor_shouldPutObjectUnderPrefixedKey()
      throws Exception {
    final S3Client s3Client = createMock(S3Client.class);

    final Capture<PutObjectRequest> requestCapture = newCapture();
    final Capture<RequestBody> bodyCapture = newCapture();
    expect(s3Client.putObject(capture(requestCapture), capture(bodyCapture)))
        .andReturn(PutObjectResponse.builder().build());
    replay(s3Client);

    store(s3Client).write("lastHistoryId/someone@example.com", "4242");

    verify(s3Client);
    assertEquals("relay-bucket", requestCapture.getValue().bucket());
    assertEquals("mailrelay/lastHistoryId/someone@example.com",
        requestCapture.getValue().key());
    final byte[] written = bodyCapture.getValue().contentStreamProvider()
        .newStream().readAllBytes();
    assertEquals("4242", new String(written, StandardCharsets.UTF_8));
  }

  @Test
  void whenReading_givenExistingObject_shouldReturnValue() {
    final S3Client s3Client = createMock(S3Client.class);

    final ResponseInputStream<GetObjectResponse> stream =
        new ResponseInputStream<>(GetObjectResponse.builder().build(),
            AbortableInputStream.create(new ByteArrayInputStream(
                "4242\n".getBytes(StandardCharsets.UTF_8))));

    final Capture<GetObjectRequest> requestCapture = newCapture();
    expect(s3Client.getObject(capture(requestCapture))).andReturn(stream);
    replay(s3Client);

    final Optional<String> value = store(s3Client).read("someone@example.com");

    verify(s3Client);
    assertEquals(Optional.of("4242"), value);
    assertEquals("mailrelay/someone@example.com",
        requestCapture.getValue().key());
  }

  @Test
  void whenReading_givenMissingObject_shouldReturnEmpty() {
    final S3Client s3Client = createMock(S3Client.class);

    expect(s3Client.getObject(anyObject(GetObjectRequest.class)))
        .andThrow(NoSuchKeyException.builder().message("missing").build());
    replay(s3Client);

    assertTrue(store(s3Client).read("someone@example.com").isEmpty());
    verify(s3Client);
  }

  @Test
  void whenWriting_givenS3Failure_shouldThrowCursorStoreException() {
    final S3Client s3Client = createMock(S3Client.class);

    expect(s3Client.putObject(anyObject(PutObjectRequest.class),
        anyObject(RequestBody.class)))
        .andThrow(S3Exception.builder().message("denied").statusCode(403)
            .build());
    replay(s3Client);

    assertThrows(CursorStoreException.class,
        () -> store(s3Client).write("k", "1"));
    verify(s3Client);
  }

  @Test
  void whenClosing_givenCallerOwnedClient_shouldNotCloseIt() {
    final S3Client s3Client = createMock(S3Client.class);
    replay(s3Client);

    store(s3Client).close();

    verify(s3Client);
  }

  @Test
  void whenBuildingConfig_givenNoBucket_shouldFail() {
    assertThrows(NullPointerException.class,
        () -> S3CursorConfig.builder().region(Region.EU_WEST_1).build());
  }
}
