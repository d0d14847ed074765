package com.defai.backend.dto;

import com.defai.backend.model.SocialPost;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostsRequest {
    @NotEmpty
    @Size(max = 500)
    private List<@Valid @NotNull SocialPost> posts;
}
