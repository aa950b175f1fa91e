package fpt.com.clinicbooking.domain.user.entity;

import fpt.com.clinicbooking.common.util.PersistableEnumConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class UserRoleConverter extends PersistableEnumConverter<UserRole> {
    public UserRoleConverter() {
        super(UserRole.class);
    }
}
