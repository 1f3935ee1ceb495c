package fasal.disease.pojo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStatus {
    private ModelStatus modelStatus;
    private String modelUsed;
    private String degradedReason;
    private boolean adviceEnabled;
    private int supportedClasses;
    private int knownDiseases;
}
