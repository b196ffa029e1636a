package com.aegis.adminapi.api;

import com.aegis.adminapi.api.dto.CreateUserRequest;
import com.aegis.adminapi.api.dto.DeactivateUsersResponse;
import com.aegis.adminapi.api.dto.UpdateProfileRequest;
import com.aegis.adminapi.api.dto.UpdateUserRequest;
import com.aegis.adminapi.api.dto.UserResponse;
import com.aegis.adminapi.config.AdminApiOperations;
import com.aegis.adminapi.domain.Page;
import com.aegis.adminapi.domain.PageRequest;
import com.aegis.adminapi.domain.UserFilter;
import com.aegis.adminapi.domain.UserService;
import com.aegis.security.Principal;
import com.aegis.security.TenantContext;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * User administration inside the request's tenant.
 *
 * <p>Every handler receives the {@link TenantContext} resolved by the route guard and passes it
 * down explicitly. Permission checks have already run when a handler is invoked.
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /** Active users unless {@code isActive=false}; {@code search} matches email or full name. */
    @GetMapping
    public Page<UserResponse> list(
            TenantContext tenant,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Boolean isActive,
            @RequestParam(required = false) String search) {
        UserFilter filter = UserFilter.of(isActive, search);
        return userService.list(tenant, filter, PageRequest.of(page, limit))
                .map(UserResponse::from);
    }

    @GetMapping("/profile")
    public UserResponse profile(TenantContext tenant, Principal principal) {
        return UserResponse.from(userService.get(tenant, principal.id()));
    }

    @PatchMapping("/profile")
    public UserResponse updateProfile(
            TenantContext tenant,
            Principal principal,
            @Valid @RequestBody UpdateProfileRequest request) {
        return UserResponse.from(
                userService.updateProfile(tenant, principal, request.fullName()));
    }

    @GetMapping("/{id}")
    public UserResponse get(TenantContext tenant, @PathVariable String id) {
        return UserResponse.from(userService.get(tenant, id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse create(
            TenantContext tenant,
            Principal principal,
            @Valid @RequestBody CreateUserRequest request) {
        return UserResponse.from(userService.create(tenant, principal, request.email(),
                request.password(), request.fullName(), request.role()));
    }

    @PatchMapping("/{id}")
    public UserResponse update(
            TenantContext tenant,
            Principal principal,
            @PathVariable String id,
            @Valid @RequestBody UpdateUserRequest request) {
        return UserResponse.from(userService.update(tenant, principal, id, request.fullName(),
                request.role(), request.isActive()));
    }

    /** Soft delete. */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(TenantContext tenant, Principal principal, @PathVariable String id) {
        userService.delete(tenant, principal, id);
    }

    /** Deactivates every user in {@code ids} (comma-separated), or none if any is not found. */
    @PostMapping("/deactivate")
    public DeactivateUsersResponse deactivate(
            TenantContext tenant, Principal principal, @RequestParam String ids) {
        List<String> parsed = AdminApiOperations.parseIds(ids);
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("ids must name at least one user");
        }
        return new DeactivateUsersResponse(
                userService.deactivateAll(tenant, principal, parsed), parsed);
    }
}
