package com.cred.freestyle.checkout.api.dto;

import com.cred.freestyle.checkout.domain.model.UserAccount;

/**
 * Public view of a user. Never carries the password hash.
 *
 * @author Checkout Team
 */
public class UserResponse {

    private Long id;
    private String name;
    private String email;

    public UserResponse() {
    }

    public static UserResponse fromEntity(UserAccount user) {
        UserResponse response = new UserResponse();
        response.setId(user.getId());
        response.setName(user.getName());
        response.setEmail(user.getEmail());
        return response;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }
}
