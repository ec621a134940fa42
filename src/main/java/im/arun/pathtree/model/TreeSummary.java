package im.arun.pathtree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistics about a scanned directory and the size of its compact encoding.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreeSummary {

    @JsonProperty("root")
    private String root;

    @JsonProperty("items")
    private long items;

    @JsonProperty("directories")
    private long directories;

    @JsonProperty("files")
    private long files;

    @JsonProperty("symlinks")
    private long symlinks;

    @JsonProperty("other")
    private long other;

    @JsonProperty("total_bytes")
    private long totalBytes;

    @JsonProperty("token_count")
    private int tokenCount;

    @JsonProperty("ascend_count")
    private int ascendCount;

    @JsonProperty("encoded_length")
    private long encodedLength;

    @JsonProperty("build_millis")
    private long buildMillis;

    @JsonProperty("missing_paths")
    private Integer missingPaths;
}
