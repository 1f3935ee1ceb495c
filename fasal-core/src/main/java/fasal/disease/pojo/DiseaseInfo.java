package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiseaseInfo {
    private String diseaseId;
    private String name;
    private String crop;
    private String cause;
    private String cure;
}
