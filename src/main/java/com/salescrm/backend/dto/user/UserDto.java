package com.salescrm.backend.dto.user;

import com.salescrm.backend.models.User;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class UserDto {
    private Long id;
    private String firstName;
    private String lastName;
    private String fullName;
    private String email;
    private String phone;
    private User.UserRole role;
    private String department;
    private Boolean isActive;
    private Long organizationId;
    private String organizationName;
    private OffsetDateTime dateJoined;
}
