package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "imageBytes")
public class DetectionRequest {
    private byte[] imageBytes;
    private String contentType;
    private String fileName;
    private String cropHint;
    private String location;

    public long getByteLength() {
        return imageBytes == null ? 0 : imageBytes.length;
    }
}
