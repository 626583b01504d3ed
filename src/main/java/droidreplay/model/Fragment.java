package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An Android fragment as seen by its activity's fragment manager. Its view
 * is the view whose id equals {@link #getFragmentId()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Fragment {

    @JsonProperty("class")       private String cls = "";
    @JsonProperty("hash")        private String hash = "";
    @JsonProperty("containerId") private String containerId;
    @JsonProperty("fragmentId")  private String fragmentId;
    @JsonProperty("hidden")      private boolean hidden;
    @JsonProperty("detached")    private boolean detached;
    @JsonProperty("active")      private boolean active;

    public Fragment() {}

    public Fragment(String cls, String hash, String containerId, String fragmentId) {
        this.cls         = cls;
        this.hash        = hash;
        this.containerId = containerId;
        this.fragmentId  = fragmentId;
    }

    /** Id of the fragment's view, same as the fragment id. */
    @JsonIgnore
    public String getViewId() {
        return fragmentId;
    }

    public String getCls()         { return cls; }
    public String getHash()        { return hash; }
    public String getContainerId() { return containerId; }
    public String getFragmentId()  { return fragmentId; }
    public boolean isHidden()      { return hidden; }
    public boolean isDetached()    { return detached; }
    public boolean isActive()      { return active; }

    public void setHidden(boolean hidden)     { this.hidden = hidden; }
    public void setDetached(boolean detached) { this.detached = detached; }
    public void setActive(boolean active)     { this.active = active; }

    @Override
    public String toString() {
        return cls + "@" + hash + (fragmentId == null ? "" : "#" + fragmentId);
    }
}
