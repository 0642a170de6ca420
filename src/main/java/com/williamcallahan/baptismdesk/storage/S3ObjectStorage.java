package com.williamcallahan.baptismdesk.storage;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * {@link ObjectStorage} backed by an S3-compatible bucket through the AWS SDK v2 sync client.
 */
public class S3ObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorage.class);
    private static final int HTTP_NOT_FOUND = 404;

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;

    public S3ObjectStorage(S3Client s3Client, S3Presigner s3Presigner, String bucket) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
        this.s3Presigner = Objects.requireNonNull(s3Presigner, "s3Presigner");
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("S3 bucket name is required");
        }
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        try {
            s3Client.putObject(putRequest(key, contentType), RequestBody.fromBytes(content));
            log.debug("Stored s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to put s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public void putFile(String key, Path source, String contentType) {
        try {
            s3Client.putObject(putRequest(key, contentType), RequestBody.fromFile(source));
            log.debug("Stored s3://{}/{} from {}", bucket, key, source);
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to put s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public byte[] get(String key) {
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(getRequest(key));
            return response.asByteArray();
        } catch (NoSuchKeyException missing) {
            throw new ObjectNotFoundException(key, missing);
        } catch (S3Exception exception) {
            if (exception.statusCode() == HTTP_NOT_FOUND) {
                throw new ObjectNotFoundException(key, exception);
            }
            throw new ObjectStorageException("Failed to get s3://" + bucket + "/" + key, exception);
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to get s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public void download(String key, Path target) {
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.deleteIfExists(partial);
            s3Client.getObject(getRequest(key), ResponseTransformer.toFile(partial));
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchKeyException missing) {
            throw new ObjectNotFoundException(key, missing);
        } catch (S3Exception exception) {
            if (exception.statusCode() == HTTP_NOT_FOUND) {
                throw new ObjectNotFoundException(key, exception);
            }
            throw new ObjectStorageException("Failed to download s3://" + bucket + "/" + key, exception);
        } catch (SdkException | java.io.IOException exception) {
            throw new ObjectStorageException("Failed to download s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to delete s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException missing) {
            return false;
        } catch (S3Exception exception) {
            if (exception.statusCode() == HTTP_NOT_FOUND) {
                return false;
            }
            throw new ObjectStorageException("Failed to head s3://" + bucket + "/" + key, exception);
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to head s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public URI presignedGetUrl(String key, Duration ttl, DownloadDisposition disposition) {
        GetObjectRequest.Builder request = GetObjectRequest.builder().bucket(bucket).key(key);
        if (disposition != null) {
            request.responseContentDisposition(disposition.headerValue());
        }
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(request.build())
                .build();
        try {
            return URI.create(s3Presigner.presignGetObject(presignRequest).url().toString());
        } catch (SdkException exception) {
            throw new ObjectStorageException("Failed to presign s3://" + bucket + "/" + key, exception);
        }
    }

    @Override
    public String describe() {
        return "s3://" + bucket;
    }

    private PutObjectRequest putRequest(String key, String contentType) {
        return PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();
    }

    private GetObjectRequest getRequest(String key) {
        return GetObjectRequest.builder().bucket(bucket).key(key).build();
    }
}
