package com.regesh.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where the input records come from and which field holds the text to classify.
 */
@Data
@NoArgsConstructor
public class InputConfig {

    /** Local directory that stands in for the blob account; containers are sub-directories. */
    private String blobRoot = "blobs";

    private String containerName = "data";

    /** Name of the JSON array blob inside the container. */
    private String blobName = "sentiment_data.json";

    /** Record field carrying the text to classify. */
    private String textField = "text";
}
