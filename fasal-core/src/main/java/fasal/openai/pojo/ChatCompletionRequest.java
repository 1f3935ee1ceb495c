package fasal.openai.pojo;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ChatCompletionRequest {
    private String model;
    private List<ChatMessage> messages = new ArrayList<>();
    private Double temperature;
    @SerializedName("max_tokens")
    private Integer maxTokens;
    private Boolean stream = false;
}
