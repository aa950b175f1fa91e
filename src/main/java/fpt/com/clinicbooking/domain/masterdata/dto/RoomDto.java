package fpt.com.clinicbooking.domain.masterdata.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class RoomDto {
    private Integer id;
    private String name;
    private String description;
    private int capacity;
    private LocalDateTime createdAt;
}
