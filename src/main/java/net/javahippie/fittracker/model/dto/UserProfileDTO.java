package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.fittracker.model.entity.UserProfile;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileDTO {

    private Long userId;
    private Integer age;
    private Double weight;
    private Double height;
    private String gender;
    private String fitnessGoal;

    public static UserProfileDTO fromEntity(UserProfile profile) {
        return UserProfileDTO.builder()
            .userId(profile.getUserId())
            .age(profile.getAge())
            .weight(profile.getWeight())
            .height(profile.getHeight())
            .gender(profile.getGender())
            .fitnessGoal(profile.getFitnessGoal())
            .build();
    }
}
