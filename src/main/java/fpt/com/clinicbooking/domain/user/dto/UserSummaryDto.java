package fpt.com.clinicbooking.domain.user.dto;

import fpt.com.clinicbooking.domain.user.entity.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {id, username} pair embedded in other resources (appointment creator, invoice creator).
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UserSummaryDto {
    private Integer id;
    private String username;

    public static UserSummaryDto of(User user) {
        return user == null ? null : new UserSummaryDto(user.getId(), user.getUsername());
    }
}
