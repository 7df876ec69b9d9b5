package com.panda.stackdeployer.feature.stack.infrastructure;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;

/**
 * The toolkit staging bucket: where templates too large to send inline are stored.
 *
 * Object keys are content addressed ({@code prefix + md5 + suffix}), so uploading
 * the same content twice yields the same key and the second upload is skipped.
 */
@Slf4j
public class ToolkitInfo {

    private final S3Client s3Client;
    private final String bucketName;
    private final String bucketEndpoint;

    public ToolkitInfo(S3Client s3Client, String bucketName, String bucketEndpoint) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.bucketEndpoint = bucketEndpoint;
    }

    public static ToolkitInfo forBucket(S3Client s3Client, String bucketName) {
        return new ToolkitInfo(s3Client, bucketName, bucketName + ".s3.amazonaws.com");
    }

    public String getBucketName() {
        return bucketName;
    }

    public String getBucketUrl() {
        return "https://" + bucketEndpoint;
    }

    /**
     * Uploads the content unless an object with the same content hash already exists.
     *
     * @param content text to store
     * @param props   key prefix/suffix and content type
     * @return the object key, and whether an upload actually happened
     */
    public UploadResult uploadIfChanged(String content, UploadProps props) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String key = props.getKeyPrefix() + DigestUtils.md5DigestAsHex(bytes) + props.getKeySuffix();

        if (objectExists(key)) {
            log.debug("{} already exists in bucket {}, skipping upload", key, bucketName);
            return new UploadResult(key, false);
        }

        log.debug("Uploading {} ({} bytes) to bucket {}", key, bytes.length, bucketName);
        s3Client.putObject(PutObjectRequest.builder()
                        .bucket(bucketName)
                        .key(key)
                        .contentType(props.getContentType())
                        .build(),
                RequestBody.fromBytes(bytes));
        return new UploadResult(key, true);
    }

    private boolean objectExists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    @Value
    public static class UploadProps {
        String keyPrefix;
        String keySuffix;
        String contentType;
    }

    @Value
    public static class UploadResult {
        String key;
        boolean changed;
    }
}
