package fpt.com.clinicbooking.domain.masterdata.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.masterdata.dto.RoomDto;
import fpt.com.clinicbooking.domain.masterdata.dto.RoomRequestDto;
import fpt.com.clinicbooking.domain.masterdata.entity.Room;
import fpt.com.clinicbooking.domain.masterdata.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class RoomService {

    private final RoomRepository repository;

    @Transactional(readOnly = true)
    public List<RoomDto> getAll() {
        return repository.findAll(Sort.by("name"))
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public RoomDto get(Integer id) {
        return toDto(findRoom(id));
    }

    public RoomDto create(RoomRequestDto dto) {
        String name = dto.getName().trim();
        if (repository.existsByNameIgnoreCase(name)) throw new ConflictException("ROOM_EXISTS");

        Room room = Room.builder()
                .name(name)
                .description(dto.getDescription())
                .build();
        if (dto.getCapacity() != null) room.setCapacity(dto.getCapacity());

        Room saved = repository.save(room);
        log.info("Room {} created", saved.getId());
        return toDto(saved);
    }

    public RoomDto update(Integer id, RoomRequestDto dto) {
        Room room = findRoom(id);
        String name = dto.getName().trim();
        if (repository.existsByNameIgnoreCaseAndIdNot(name, id)) throw new ConflictException("ROOM_EXISTS");

        room.setName(name);
        room.setDescription(dto.getDescription());
        if (dto.getCapacity() != null) room.setCapacity(dto.getCapacity());
        return toDto(repository.save(room));
    }

    /**
     * Appointments booked in the room keep their rows with no room (ON DELETE SET NULL).
     */
    public void delete(Integer id) {
        repository.delete(findRoom(id));
        log.info("Room {} deleted", id);
    }

    private Room findRoom(Integer id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("ROOM_NOT_FOUND", Map.of("id", id)));
    }

    private RoomDto toDto(Room e) {
        return new RoomDto(e.getId(), e.getName(), e.getDescription(), e.getCapacity(), e.getCreatedAt());
    }
}
