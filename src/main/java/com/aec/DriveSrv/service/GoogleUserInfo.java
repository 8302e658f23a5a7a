package com.aec.DriveSrv.service;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

/** OpenID Connect userinfo document. */
public class GoogleUserInfo extends GenericJson {

    @Key
    private String sub;

    @Key
    private String email;

    @Key
    private String name;

    public String getSub() { return sub; }
    public void setSub(String sub) { this.sub = sub; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
